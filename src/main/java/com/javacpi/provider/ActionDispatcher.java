package com.javacpi.provider;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.javacpi.exec.ExecutionResult;
import com.javacpi.exec.ToolExecutor;
import com.javacpi.normalize.ScalarDecoder;
import com.javacpi.observability.MetricsConfig;
import com.javacpi.schema.ActionDefinition;
import com.javacpi.schema.ActionName;
import com.javacpi.schema.ParameterValidator;
import com.javacpi.schema.ValidatedArguments;
import com.javacpi.shared.config.LookupFailurePolicy;
import com.javacpi.shared.error.ActionException;
import com.javacpi.shared.error.ActionNotFoundException;
import com.javacpi.shared.error.FailureKind;
import com.javacpi.shared.error.MalformedOutputException;
import com.javacpi.shared.error.ParameterValidationException;
import com.javacpi.shared.error.ResourceConflictException;
import com.javacpi.shared.error.ToolExecutionException;
import com.javacpi.shared.model.ActionResult;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs an action through validate, render, execute and normalize, in that order. The
 * first stage to fail ends the invocation, and its failure becomes the returned result.
 * Holds no per-invocation state, so concurrent callers need no coordination.
 */
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> PARAMS = new TypeReference<>() {};

    private final ActionCatalog catalog;
    private final ToolExecutor executor;
    private final LookupFailurePolicy lookupFailurePolicy;
    private final MetricsConfig metrics;
    private final ParameterValidator validator = new ParameterValidator();

    public ActionDispatcher(ActionCatalog catalog, ToolExecutor executor,
                            LookupFailurePolicy lookupFailurePolicy, MetricsConfig metrics) {
        this.catalog = catalog;
        this.executor = executor;
        this.lookupFailurePolicy = lookupFailurePolicy;
        this.metrics = metrics;
    }

    public List<ActionName> listActions() {
        return catalog.names();
    }

    public Optional<ActionDefinition> describeAction(String name) {
        return catalog.find(name).map(ActionEntry::definition);
    }

    public ActionResult execute(String name, JsonNode parameters) {
        if (parameters == null || parameters.isNull() || parameters.isMissingNode()) {
            return execute(name, Map.of());
        }
        return dispatch(name, () -> {
            if (!parameters.isObject()) {
                throw ParameterValidationException.notAnObject(name, parameters.getNodeType().name());
            }
            return MAPPER.convertValue(parameters, PARAMS);
        });
    }

    public ActionResult execute(String name, Map<String, ?> parameters) {
        return dispatch(name, () -> parameters == null ? Map.of() : parameters);
    }

    /** Parameters are read only after the action is found, so an unknown name always wins. */
    private ActionResult dispatch(String name, Supplier<Map<String, ?>> parameters) {
        metrics.actionCalls().increment();
        var sample = Timer.start(metrics.registry());
        var tag = ActionName.fromId(name).map(ActionName::id).orElse("unknown");
        try {
            var entry = catalog.find(name).orElseThrow(() -> new ActionNotFoundException(name));
            log.info("Executing action '{}'", name);
            var result = ActionResult.ok(run(entry, parameters.get()));
            log.info("Action '{}' succeeded", name);
            return result;
        } catch (ActionException e) {
            return fail(name, e.kind(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure in action '{}'", name, e);
            return fail(name, FailureKind.INTERNAL_ERROR, "Internal error in action '" + name + "': " + e);
        } finally {
            sample.stop(metrics.actionLatency(tag));
        }
    }

    private ObjectNode run(ActionEntry entry, Map<String, ?> parameters) {
        var args = validator.validate(entry.definition(), parameters);
        entry.presence().ifPresent(check -> ensureAbsent(entry, check, args));
        var raw = invoke(entry.script().render(args));
        return entry.normalizer().normalize(raw, args);
    }

    private void ensureAbsent(ActionEntry entry, PresenceCheck check, ValidatedArguments args) {
        long count;
        try {
            count = ScalarDecoder.count(invoke(check.countScript().render(args)).stdout());
        } catch (ToolExecutionException | MalformedOutputException e) {
            if (lookupFailurePolicy == LookupFailurePolicy.FAIL) {
                throw e;
            }
            log.warn("Presence check for '{}' failed, assuming absent: {}",
                    entry.definition().name(), e.getMessage());
            return;
        }
        if (count > 0) {
            throw new ResourceConflictException(check.conflictMessage().apply(args));
        }
    }

    private ExecutionResult invoke(String script) {
        metrics.toolInvocations().increment();
        var raw = executor.execute(script);
        if (!raw.succeeded()) {
            throw new ToolExecutionException(raw.stderr(), raw.exitCode());
        }
        return raw;
    }

    private ActionResult fail(String name, FailureKind kind, String message) {
        log.warn("Action '{}' failed [{}]: {}", name, kind, message);
        metrics.actionFailures(kind).increment();
        return ActionResult.failure(kind, message);
    }
}
