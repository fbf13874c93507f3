package io.clustersearch.command;

import io.clustersearch.enums.CommandAction;
import io.clustersearch.exceptions.InvalidQueryConfigurationException;
import io.clustersearch.models.SearchOptions;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses the command's {@code key=value} arguments into {@link SearchOptions}.
 *
 * Values may be wrapped in double quotes; later occurrences of a key replace earlier ones.
 */
@Slf4j
public final class CommandArguments {

    public static final Set<String> KNOWN_KEYS = Set.of(
        "eaddr", "index", "query", "tsfield", "earliest", "latest", "fields", "action",
        "scan", "limit", "page_size", "include_es", "include_raw", "use_ssl", "verify_certs");

    /** Accepted for older invocations, no effect: clusters no longer have document types. */
    public static final Set<String> IGNORED_KEYS = Set.of("stype");

    private CommandArguments() {
    }

    public static SearchOptions parse(String[] args) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String arg : args) {
            if (arg == null || arg.isBlank()) {
                continue;
            }
            int separator = arg.indexOf('=');
            if (separator <= 0) {
                throw new InvalidQueryConfigurationException("Expected key=value argument but got '" + arg + "'");
            }
            String key = arg.substring(0, separator).trim().toLowerCase();
            if (IGNORED_KEYS.contains(key)) {
                log.warn("Ignoring option '{}', document types are not supported by the cluster", key);
                continue;
            }
            if (!KNOWN_KEYS.contains(key)) {
                throw new InvalidQueryConfigurationException("Unknown option '" + key + "'");
            }
            values.put(key, unquote(arg.substring(separator + 1).trim()));
        }
        return toOptions(values);
    }

    /**
     * Split a single argument line on spaces, keeping double-quoted values together.
     */
    public static SearchOptions parse(String argumentLine) {
        return parse(tokenize(argumentLine).toArray(new String[0]));
    }

    static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        if (line == null) {
            return tokens;
        }
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '\\' && quoted && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                current.append("\\\"");
                i++;
            } else if (c == '"') {
                quoted = !quoted;
                current.append(c);
            } else if (Character.isWhitespace(c) && !quoted) {
                if (current.length() > 0) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (quoted) {
            throw new InvalidQueryConfigurationException("Unterminated quote in arguments: " + line);
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static SearchOptions toOptions(Map<String, String> values) {
        SearchOptions.SearchOptionsBuilder builder = SearchOptions.builder()
            .action(CommandAction.fromString(values.get("action")))
            .eaddr(values.get("eaddr"))
            .index(values.get("index"))
            .query(values.get("query"))
            .timestampField(values.get("tsfield"))
            .earliest(values.get("earliest"))
            .latest(values.get("latest"));

        String fields = values.get("fields");
        if (fields != null && !fields.isBlank()) {
            Arrays.stream(fields.split(","))
                .map(String::trim)
                .filter(field -> !field.isEmpty())
                .forEach(builder::field);
        }
        if (values.containsKey("scan")) {
            builder.scan(parseBoolean("scan", values.get("scan")));
        }
        if (values.containsKey("limit")) {
            builder.limit(parseInt("limit", values.get("limit"), 0));
        }
        if (values.containsKey("page_size")) {
            builder.pageSize(parseInt("page_size", values.get("page_size"), 1));
        }
        if (values.containsKey("include_es")) {
            builder.includeEs(parseBoolean("include_es", values.get("include_es")));
        }
        if (values.containsKey("include_raw")) {
            builder.includeRaw(parseBoolean("include_raw", values.get("include_raw")));
        }
        if (values.containsKey("use_ssl")) {
            builder.useSsl(parseBoolean("use_ssl", values.get("use_ssl")));
        }
        if (values.containsKey("verify_certs")) {
            builder.verifyCerts(parseBoolean("verify_certs", values.get("verify_certs")));
        }
        return builder.build();
    }

    private static boolean parseBoolean(String key, String value) {
        switch (value == null ? "" : value.trim().toLowerCase()) {
            case "true":
            case "t":
            case "yes":
            case "y":
            case "1":
                return true;
            case "false":
            case "f":
            case "no":
            case "n":
            case "0":
                return false;
            default:
                throw new InvalidQueryConfigurationException(
                    String.format("Option '%s' must be a boolean but was '%s'", key, value));
        }
    }

    private static int parseInt(String key, String value, int minimum) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < minimum) {
                throw new InvalidQueryConfigurationException(
                    String.format("Option '%s' must be at least %d but was %d", key, minimum, parsed));
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new InvalidQueryConfigurationException(
                String.format("Option '%s' must be an integer but was '%s'", key, value), e);
        }
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1).replace("\\\"", "\"");
        }
        return value;
    }
}
