package com.javacpi.schema;

import java.util.Arrays;
import java.util.Optional;

public enum ActionName {
    TEST_INSTALL("test_install"),
    LIST_WORKERS("list_workers"),
    CREATE_WORKER("create_worker"),
    DELETE_WORKER("delete_worker"),
    GET_WORKER("get_worker"),
    HAS_WORKER("has_worker"),
    START_WORKER("start_worker"),
    GET_VOLUMES("get_volumes"),
    HAS_VOLUME("has_volume"),
    CREATE_VOLUME("create_volume"),
    DELETE_VOLUME("delete_volume"),
    ATTACH_VOLUME("attach_volume"),
    DETACH_VOLUME("detach_volume"),
    CREATE_SNAPSHOT("create_snapshot"),
    DELETE_SNAPSHOT("delete_snapshot"),
    HAS_SNAPSHOT("has_snapshot"),
    REBOOT_WORKER("reboot_worker"),
    CONFIGURE_NETWORKS("configure_networks"),
    SET_WORKER_METADATA("set_worker_metadata"),
    SNAPSHOT_VOLUME("snapshot_volume");

    private final String id;

    ActionName(String id) {
        this.id = id;
    }

    public String id() { return id; }

    public static Optional<ActionName> fromId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values()).filter(a -> a.id.equals(id)).findFirst();
    }

    @Override
    public String toString() {
        return id;
    }
}
