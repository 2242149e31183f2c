package com.hartwig.varpipe.tool;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Ordered argument list with ${key} placeholders. Each argument stays one process argument after substitution, no shell splitting.
 */
public final class CommandTemplate {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_.-]+)}");

    private final List<String> arguments;

    private CommandTemplate(final List<String> arguments) {
        this.arguments = List.copyOf(arguments);
    }

    public static CommandTemplate of(List<String> arguments) {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("Command template needs at least one argument");
        }
        return new CommandTemplate(arguments);
    }

    public List<String> arguments() {
        return arguments;
    }

    public List<String> render(Map<String, String> values) {
        return arguments.stream().map(argument -> replaceKeys(argument, values)).collect(Collectors.toList());
    }

    private static String replaceKeys(String input, Map<String, String> map) {
        var output = input;
        for (var entry : map.entrySet()) {
            var key = "${" + entry.getKey() + "}";
            output = output.replace(key, entry.getValue());
        }
        var unresolved = PLACEHOLDER.matcher(output);
        if (unresolved.find()) {
            throw new IllegalArgumentException(String.format("No value for placeholder '%s' in argument '%s'", unresolved.group(1), input));
        }
        return output;
    }

    @Override
    public String toString() {
        return String.join(" ", arguments);
    }
}
