package com.javacpi.provider;

import com.javacpi.schema.ValidatedArguments;
import com.javacpi.script.ScriptTemplate;

import java.util.function.Function;

/**
 * A count query run before a create action; a positive count means the resource
 * already exists and the create is refused.
 */
public record PresenceCheck(ScriptTemplate countScript, Function<ValidatedArguments, String> conflictMessage) {}
