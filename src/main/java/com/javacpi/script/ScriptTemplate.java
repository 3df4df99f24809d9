package com.javacpi.script;

import com.javacpi.schema.ValidatedArguments;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Produces the script text of one action from its validated arguments.
 */
public interface ScriptTemplate {

    String render(ValidatedArguments args);

    /** Argument names this template substitutes; checked against the action schema. */
    Set<String> placeholders();

    /** One script of {@code statements} executed in order within a single process. */
    static ScriptTemplate of(String... statements) {
        return new TextTemplate(String.join("; ", statements));
    }

    /**
     * A statement whose failure is swallowed inside the script, so the statements after it
     * still run and the exit status reflects only the primary statements.
     */
    static String nonFatal(String statement) {
        return "try { " + statement + " } catch { $null = $_ }";
    }

    /**
     * Picks a variant by the lower-cased value of a string argument, falling back when
     * the value matches no key.
     */
    static ScriptTemplate byChoice(String param, Map<String, ScriptTemplate> variants, ScriptTemplate fallback) {
        var byKey = new LinkedHashMap<String, ScriptTemplate>();
        variants.forEach((k, v) -> byKey.put(k.toLowerCase(Locale.ROOT), v));
        var names = new HashSet<String>(fallback.placeholders());
        names.add(param);
        byKey.values().forEach(v -> names.addAll(v.placeholders()));
        var placeholders = Set.copyOf(names);

        return new ScriptTemplate() {
            @Override
            public String render(ValidatedArguments args) {
                var choice = args.string(param).toLowerCase(Locale.ROOT);
                return byKey.getOrDefault(choice, fallback).render(args);
            }

            @Override
            public Set<String> placeholders() {
                return placeholders;
            }
        };
    }
}
