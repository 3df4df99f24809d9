package com.javacpi.schema;

import com.javacpi.shared.error.ParameterValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

public class ParameterValidator {

    private static final Logger log = LoggerFactory.getLogger(ParameterValidator.class);

    /**
     * Coerces {@code input} against the action's schema. A key mapped to {@code null}
     * counts as absent; keys the schema does not declare are ignored.
     *
     * @throws ParameterValidationException on a missing required parameter or a type mismatch
     */
    public ValidatedArguments validate(ActionDefinition definition, Map<String, ?> input) {
        var action = definition.name().id();
        var values = new LinkedHashMap<String, Object>();
        for (var spec : definition.parameters()) {
            var raw = input.get(spec.name());
            if (raw == null) {
                if (spec.required()) {
                    throw ParameterValidationException.missing(action, spec.name());
                }
                values.put(spec.name(), spec.defaultValue());
                continue;
            }
            var coerced = spec.kind().coerce(raw)
                    .orElseThrow(() -> ParameterValidationException.typeMismatch(
                            action, spec.name(), spec.kind().schemaType(), raw));
            values.put(spec.name(), coerced);
        }
        for (var key : input.keySet()) {
            if (definition.parameter(key).isEmpty()) {
                log.debug("Ignoring unknown parameter '{}' for action '{}'", key, action);
            }
        }
        return new ValidatedArguments(values);
    }
}
