package io.github.cyfko.hypermedia.core.utils;

import io.github.cyfko.hypermedia.core.exception.MissingParameterException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Substitution of {@code {placeholder}} segments in path templates.
 *
 * <pre>{@code
 * PathTemplates.expand("/items/{item_id}", Map.of("item_id", 42), "view_item");   // "/items/42"
 * PathTemplates.placeholders("/a/{x}/b/{y}");                                    // [x, y]
 * }</pre>
 *
 * @author cyfko
 * @since 1.0
 */
public final class PathTemplates {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([^{}]+)}");

    private PathTemplates() {
        // utility
    }

    /**
     * Lists the placeholder names of a template in order of appearance.
     */
    public static List<String> placeholders(String template) {
        List<String> names = new ArrayList<>();
        Matcher matcher = PLACEHOLDER.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    /**
     * Replaces every placeholder with the string form of the matching context value.
     * Context entries that the template does not use are ignored.
     *
     * @param template       path template
     * @param context        placeholder values
     * @param transitionName name reported when a placeholder is missing
     * @return the expanded path
     * @throws MissingParameterException on the first placeholder without a context value
     */
    public static String expand(String template, Map<String, ?> context, String transitionName) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder expanded = new StringBuilder(template.length());
        while (matcher.find()) {
            String name = matcher.group(1);
            if (context == null || !context.containsKey(name)) {
                throw new MissingParameterException(name, transitionName, template);
            }
            matcher.appendReplacement(expanded, Matcher.quoteReplacement(String.valueOf(Values.scalar(context.get(name)))));
        }
        matcher.appendTail(expanded);
        return expanded.toString();
    }
}
