package org.mathcore;

import java.util.*;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Immutable settings of a {@link LatexToMathML} converter.
 *
 * <p>Macro bodies are kept as written; they are validated when a converter is built
 * from this configuration.
 *
 * @param prettyPrint whitespace policy of the output
 * @param macros user commands, name (without backslash) to body
 * @param xmlNamespace declare the MathML namespace on the root element
 * @param continueOnError replace failing fragments with inline markers
 * @param ignoreUnknownCommands replace unknown commands with inline markers
 * @param annotation wrap the output in a semantics element carrying the source
 */
public record ConversionConfig(
    PrettyPrint prettyPrint,
    Map<String, String> macros,
    boolean xmlNamespace,
    boolean continueOnError,
    boolean ignoreUnknownCommands,
    boolean annotation
) {
    public ConversionConfig {
        Objects.requireNonNull(prettyPrint, "prettyPrint");
        Objects.requireNonNull(macros, "macros");
        macros = Collections.unmodifiableMap(new LinkedHashMap<>(macros));
    }

    public static ConversionConfig defaults() {
        return new ConversionConfig(PrettyPrint.NEVER, Map.of(), false, false, false, false);
    }

    public ConversionConfig withPrettyPrint(PrettyPrint value) {
        return new ConversionConfig(value, macros, xmlNamespace, continueOnError, ignoreUnknownCommands, annotation);
    }

    public ConversionConfig withMacros(Map<String, String> value) {
        return new ConversionConfig(prettyPrint, value, xmlNamespace, continueOnError, ignoreUnknownCommands, annotation);
    }

    public ConversionConfig withXmlNamespace(boolean value) {
        return new ConversionConfig(prettyPrint, macros, value, continueOnError, ignoreUnknownCommands, annotation);
    }

    public ConversionConfig withContinueOnError(boolean value) {
        return new ConversionConfig(prettyPrint, macros, xmlNamespace, value, ignoreUnknownCommands, annotation);
    }

    public ConversionConfig withIgnoreUnknownCommands(boolean value) {
        return new ConversionConfig(prettyPrint, macros, xmlNamespace, continueOnError, value, annotation);
    }

    public ConversionConfig withAnnotation(boolean value) {
        return new ConversionConfig(prettyPrint, macros, xmlNamespace, continueOnError, ignoreUnknownCommands, value);
    }

    /**
     * Reads a configuration from a JSON object with kebab-case keys:
     * {@code pretty-print}, {@code macros}, {@code xml-namespace},
     * {@code continue-on-error}, {@code ignore-unknown-commands}, {@code annotation}.
     * Missing keys keep their defaults.
     *
     * @throws LatexError with category {@link ErrorCategory#INVALID_CONFIGURATION_VALUE}
     *     on malformed JSON, unknown keys or values of the wrong type
     */
    public static ConversionConfig fromJson(String json) {
        JsonElement root;
        try {
            root = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw invalid("<root>", "malformed JSON (" + e.getMessage() + ")");
        }
        if (!root.isJsonObject()) {
            throw invalid("<root>", "expected a JSON object");
        }

        var config = defaults();
        for (var entry : root.getAsJsonObject().entrySet()) {
            var key = entry.getKey();
            var value = entry.getValue();
            config = switch (key) {
                case "pretty-print" -> config.withPrettyPrint(PrettyPrint.parse(string(key, value)));
                case "macros" -> config.withMacros(macros(key, value));
                case "xml-namespace" -> config.withXmlNamespace(bool(key, value));
                case "continue-on-error" -> config.withContinueOnError(bool(key, value));
                case "ignore-unknown-commands" -> config.withIgnoreUnknownCommands(bool(key, value));
                case "annotation" -> config.withAnnotation(bool(key, value));
                default -> throw invalid(key, "unknown option");
            };
        }
        return config;
    }

    private static String string(String key, JsonElement value) {
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isString()) {
            return value.getAsString();
        }
        throw invalid(key, "expected a string");
    }

    private static boolean bool(String key, JsonElement value) {
        if (value.isJsonPrimitive() && value.getAsJsonPrimitive().isBoolean()) {
            return value.getAsBoolean();
        }
        throw invalid(key, "expected a boolean");
    }

    private static Map<String, String> macros(String key, JsonElement value) {
        if (!value.isJsonObject()) {
            throw invalid(key, "expected an object of name to body");
        }
        JsonObject object = value.getAsJsonObject();
        var result = new LinkedHashMap<String, String>();
        for (var entry : object.entrySet()) {
            var body = entry.getValue();
            if (!(body instanceof JsonPrimitive primitive) || !primitive.isString()) {
                throw invalid(key + "." + entry.getKey(), "expected a string");
            }
            result.put(entry.getKey(), body.getAsString());
        }
        return result;
    }

    private static LatexError invalid(String key, String reason) {
        return LatexError.of(ErrorKind.INVALID_CONFIG_VALUE, Span.at(0), key, reason);
    }
}
