package com.javacpi.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public record ActionDefinition(
    ActionName name,
    String description,
    List<ParameterSpec> parameters
) {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public ActionDefinition {
        parameters = List.copyOf(parameters);
        var seen = new HashSet<String>();
        for (var p : parameters) {
            if (!seen.add(p.name())) {
                throw new IllegalArgumentException("Duplicate parameter '" + p.name() + "' in action " + name);
            }
        }
    }

    public static ActionDefinition of(ActionName name, String description, ParameterSpec... parameters) {
        return new ActionDefinition(name, description, List.of(parameters));
    }

    public Optional<ParameterSpec> parameter(String paramName) {
        return parameters.stream().filter(p -> p.name().equals(paramName)).findFirst();
    }

    /**
     * Replaces the defaults of optional parameters named in {@code overrides}; other keys are ignored.
     */
    public ActionDefinition withDefaults(Map<String, Object> overrides) {
        var updated = new ArrayList<ParameterSpec>(parameters.size());
        for (var p : parameters) {
            updated.add(!p.required() && overrides.containsKey(p.name())
                    ? p.withDefault(overrides.get(p.name()))
                    : p);
        }
        return new ActionDefinition(name, description, updated);
    }

    public JsonNode inputSchema() {
        var props = MAPPER.createObjectNode();
        var required = MAPPER.createArrayNode();
        for (var p : parameters) {
            var prop = MAPPER.createObjectNode()
                    .put("type", p.kind().schemaType())
                    .put("description", p.description());
            if (p.required()) {
                required.add(p.name());
            } else {
                prop.set("default", MAPPER.valueToTree(p.defaultValue()));
            }
            props.set(p.name(), prop);
        }
        return MAPPER.createObjectNode()
                .put("type", "object")
                .<ObjectNode>set("properties", props)
                .set("required", required);
    }
}
