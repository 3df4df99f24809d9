package com.javacpi.provider;

import com.javacpi.schema.ActionName;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class ActionCatalog {

    private final Map<ActionName, ActionEntry> entries = new LinkedHashMap<>();

    public ActionCatalog register(ActionEntry entry) {
        var name = entry.definition().name();
        if (entries.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate action: " + name);
        }
        entries.put(name, entry);
        return this;
    }

    public Optional<ActionEntry> find(String id) {
        return ActionName.fromId(id).map(entries::get);
    }

    public ActionEntry get(ActionName name) {
        return entries.get(name);
    }

    public List<ActionName> names() {
        return List.copyOf(entries.keySet());
    }

    public Collection<ActionEntry> all() {
        return entries.values();
    }
}
