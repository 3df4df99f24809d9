package com.javacpi.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.javacpi.exec.ExecutionResult;
import com.javacpi.schema.ValidatedArguments;
import com.javacpi.shared.error.MalformedOutputException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * The closed set of output normalizers. Each action picks one when the catalog is
 * built; every payload starts as {@code {"success": true}}.
 */
public final class Normalizers {

    private static final Logger log = LoggerFactory.getLogger(Normalizers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private Normalizers() {}

    /** Fills action-specific fields into a payload. */
    @FunctionalInterface
    public interface PayloadMapper<T> {
        void fill(ObjectNode payload, T decoded, ValidatedArguments args);
    }

    private record Variant(OutputShape shape, BiFunction<ExecutionResult, ValidatedArguments, ObjectNode> fn)
            implements OutputNormalizer {

        @Override
        public ObjectNode normalize(ExecutionResult raw, ValidatedArguments args) {
            return fn.apply(raw, args);
        }
    }

    public static ObjectNode successPayload() {
        return MAPPER.createObjectNode().put("success", true);
    }

    public static OutputNormalizer sideEffect() {
        return sideEffect((payload, ignored, args) -> { });
    }

    /** Output is ignored; {@code echo} may copy arguments into the payload. */
    public static OutputNormalizer sideEffect(PayloadMapper<Void> echo) {
        return new Variant(OutputShape.SIDE_EFFECT_ONLY, (raw, args) -> {
            var payload = successPayload();
            echo.fill(payload, null, args);
            return payload;
        });
    }

    public static OutputNormalizer csv(List<String> columns, String collectionField,
                                       Function<Map<String, String>, JsonNode> row) {
        return new Variant(OutputShape.CSV, (raw, args) -> {
            var payload = successPayload();
            var items = payload.putArray(collectionField);
            CsvDecoder.decode(raw.stdout(), columns).forEach(r -> items.add(row.apply(r)));
            return payload;
        });
    }

    public static OutputNormalizer jsonObject(PayloadMapper<JsonNode> mapper) {
        return new Variant(OutputShape.JSON_OBJECT, (raw, args) -> {
            var payload = successPayload();
            mapper.fill(payload, JsonDecoder.object(raw.stdout()), args);
            return payload;
        });
    }

    /**
     * For actions whose side effect already happened when the tool exited cleanly: output
     * that does not parse yields a payload synthesized by {@code fallback} instead of a failure.
     */
    public static OutputNormalizer jsonObjectOrFallback(PayloadMapper<JsonNode> mapper,
                                                        PayloadMapper<Void> fallback) {
        return new Variant(OutputShape.JSON_OBJECT, (raw, args) -> {
            var payload = successPayload();
            try {
                mapper.fill(payload, JsonDecoder.object(raw.stdout()), args);
            } catch (MalformedOutputException e) {
                log.debug("Using synthesized result, output did not parse: {}", e.getMessage());
                payload = successPayload();
                fallback.fill(payload, null, args);
            }
            return payload;
        });
    }

    public static OutputNormalizer jsonOneOrMany(String collectionField, Function<JsonNode, JsonNode> record) {
        return new Variant(OutputShape.JSON_ONE_OR_MANY, (raw, args) -> {
            var payload = successPayload();
            var items = payload.putArray(collectionField);
            JsonDecoder.oneOrMany(raw.stdout()).forEach(n -> items.add(record.apply(n)));
            return payload;
        });
    }

    /** {@code exists := count > 0}. */
    public static OutputNormalizer existsByCount() {
        return new Variant(OutputShape.SCALAR_COUNT, (raw, args) ->
                successPayload().put("exists", ScalarDecoder.count(raw.stdout()) > 0));
    }

    public static OutputNormalizer existsByBoolean() {
        return new Variant(OutputShape.SCALAR_BOOLEAN, (raw, args) ->
                successPayload().put("exists", ScalarDecoder.bool(raw.stdout())));
    }

    public static OutputNormalizer composite(PayloadMapper<String> mapper) {
        return new Variant(OutputShape.COMPOSITE, (raw, args) -> {
            var payload = successPayload();
            mapper.fill(payload, raw.stdout(), args);
            return payload;
        });
    }
}
