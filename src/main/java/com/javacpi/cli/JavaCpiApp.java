package com.javacpi.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.javacpi.exec.PowerShellExecutor;
import com.javacpi.observability.DoctorCommand;
import com.javacpi.observability.MetricsConfig;
import com.javacpi.provider.CpiProvider;
import com.javacpi.provider.HyperVProvider;
import com.javacpi.schema.ActionDefinition;
import com.javacpi.shared.config.ConfigLoader;
import com.javacpi.shared.model.ActionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class JavaCpiApp {

    private static final Logger log = LoggerFactory.getLogger(JavaCpiApp.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final TypeReference<Map<String, Object>> PARAMS = new TypeReference<>() {};

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private static final String USAGE_TEXT = """
            Usage:
              javacpi list
              javacpi describe <action>
              javacpi run <action> [key=value ...]     values are YAML scalars: size_mb=4096, name='"123"'
              javacpi run <action> --json '{"key": "value"}'
              javacpi doctor
            """;

    public static void main(String[] args) {
        var config = ConfigLoader.load();
        if (args.length > 0 && "doctor".equals(args[0])) {
            var executor = new PowerShellExecutor(config.executor());
            System.out.println(new DoctorCommand(executor, config.executor().executable(), ConfigLoader.DEFAULT_PATH).run());
            return;
        }
        var provider = HyperVProvider.create(config, new MetricsConfig());
        System.exit(run(args, provider, System.out, System.err));
    }

    static int run(String[] args, CpiProvider provider, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            err.print(USAGE_TEXT);
            return USAGE;
        }
        var command = args[0];
        var rest = Arrays.asList(args).subList(1, args.length);
        try {
            return switch (command) {
                case "list" -> list(provider, out);
                case "describe" -> describe(rest, provider, out, err);
                case "run" -> runAction(rest, provider, out, err);
                default -> {
                    err.println("Unknown command: " + command);
                    err.print(USAGE_TEXT);
                    yield USAGE;
                }
            };
        } catch (JsonProcessingException e) {
            err.println("Invalid JSON: " + e.getOriginalMessage());
            return USAGE;
        }
    }

    private static int list(CpiProvider provider, PrintStream out) {
        for (var name : provider.listActions()) {
            var description = provider.describeAction(name.id()).map(ActionDefinition::description).orElse("");
            out.printf("%-22s %s%n", name.id(), description);
        }
        return OK;
    }

    private static int describe(List<String> rest, CpiProvider provider, PrintStream out, PrintStream err)
            throws JsonProcessingException {
        if (rest.size() != 1) {
            err.print(USAGE_TEXT);
            return USAGE;
        }
        var definition = provider.describeAction(rest.get(0));
        if (definition.isEmpty()) {
            err.println("Action '" + rest.get(0) + "' not found");
            return FAILED;
        }
        var node = MAPPER.createObjectNode()
                .put("name", definition.get().name().id())
                .put("description", definition.get().description());
        node.set("parameters", definition.get().inputSchema());
        out.println(MAPPER.writeValueAsString(node));
        return OK;
    }

    private static int runAction(List<String> rest, CpiProvider provider, PrintStream out, PrintStream err)
            throws JsonProcessingException {
        if (rest.isEmpty()) {
            err.print(USAGE_TEXT);
            return USAGE;
        }
        var action = rest.get(0);
        var paramArgs = rest.subList(1, rest.size());
        Map<String, Object> params;
        if (!paramArgs.isEmpty() && "--json".equals(paramArgs.get(0))) {
            if (paramArgs.size() != 2) {
                err.print(USAGE_TEXT);
                return USAGE;
            }
            params = MAPPER.readValue(paramArgs.get(1), PARAMS);
        } else {
            params = new LinkedHashMap<>();
            for (var arg : paramArgs) {
                var eq = arg.indexOf('=');
                if (eq <= 0) {
                    err.println("Expected key=value, got: " + arg);
                    return USAGE;
                }
                params.put(arg.substring(0, eq), parseValue(arg.substring(eq + 1)));
            }
        }
        var result = provider.execute(action, params);
        out.println(MAPPER.writeValueAsString(render(result)));
        return result.isError() ? FAILED : OK;
    }

    /** A YAML scalar when the text reads as one, the raw text otherwise. */
    static Object parseValue(String text) {
        try {
            Object value = new Yaml().load(text);
            if (value instanceof String || value instanceof Number || value instanceof Boolean) {
                return value;
            }
        } catch (RuntimeException e) {
            log.debug("Not a YAML scalar, passing '{}' as text: {}", text, e.getMessage());
        }
        return text;
    }

    private static Object render(ActionResult result) {
        if (!result.isError()) return result.payload();
        return MAPPER.createObjectNode()
                .put("success", false)
                .put("kind", result.failure().kind().name())
                .put("error", result.failure().message());
    }
}
