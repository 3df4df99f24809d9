package com.javacpi.provider;

import com.javacpi.schema.ActionDefinition;
import com.javacpi.schema.ActionName;
import com.javacpi.shared.model.ActionResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Host-facing contract of a resource-control provider.
 */
public interface CpiProvider {

    String name();

    String providerType();

    Map<String, Object> defaultSettings();

    List<ActionName> listActions();

    Optional<ActionDefinition> describeAction(String action);

    ActionResult execute(String action, Map<String, ?> parameters);
}
