package com.javacpi.provider;

import com.javacpi.normalize.OutputNormalizer;
import com.javacpi.schema.ActionDefinition;
import com.javacpi.schema.ParameterSpec;
import com.javacpi.script.ScriptTemplate;

import java.util.HashSet;
import java.util.Optional;
import java.util.stream.Collectors;

public record ActionEntry(
    ActionDefinition definition,
    ScriptTemplate script,
    OutputNormalizer normalizer,
    PresenceCheck presenceCheck
) {
    public ActionEntry {
        var declared = definition.parameters().stream()
                .map(ParameterSpec::name)
                .collect(Collectors.toSet());
        var used = new HashSet<>(script.placeholders());
        if (presenceCheck != null) {
            used.addAll(presenceCheck.countScript().placeholders());
        }
        used.removeAll(declared);
        if (!used.isEmpty()) {
            throw new IllegalArgumentException("Script of " + definition.name()
                    + " references undeclared parameters " + used);
        }
    }

    public ActionEntry(ActionDefinition definition, ScriptTemplate script, OutputNormalizer normalizer) {
        this(definition, script, normalizer, null);
    }

    public Optional<PresenceCheck> presence() {
        return Optional.ofNullable(presenceCheck);
    }
}
