package io.github.cyfko.hypermedia.core.resolution;

import io.github.cyfko.hypermedia.core.catalog.Transition;
import io.github.cyfko.hypermedia.core.model.FieldDescriptor;
import io.github.cyfko.hypermedia.core.model.Link;
import io.github.cyfko.hypermedia.core.model.Query;
import io.github.cyfko.hypermedia.core.model.Template;
import io.github.cyfko.hypermedia.core.utils.Values;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A transition whose path template has been substituted with concrete values.
 * <p>
 * Conversions to {@link Link}, {@link Query} and {@link Template} are read-only: each can be called
 * any number of times, in any order, and always returns a fresh object built from the same data.
 * </p>
 *
 * @param name   operation name
 * @param href   substituted path
 * @param rel    default relation (space-joined tags)
 * @param title  operation summary
 * @param method HTTP method
 * @param fields ordered field descriptors
 *
 * @author cyfko
 * @since 1.0
 */
public record ResolvedTransition(
        String name,
        String href,
        String rel,
        String title,
        String method,
        List<FieldDescriptor> fields
) {

    public ResolvedTransition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(href, "href");
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    static ResolvedTransition of(Transition transition, String href) {
        return new ResolvedTransition(transition.name(), href, transition.rel(), transition.title(),
                transition.method(), transition.fields());
    }

    public Link toLink() {
        return toLink(null);
    }

    /**
     * @param relOverride relation to use instead of the default; ignored when {@code null} or empty
     */
    public Link toLink(String relOverride) {
        String linkRel = relOverride == null || relOverride.isEmpty() ? rel : relOverride;
        return new Link(linkRel, href, title, method);
    }

    public Query toQuery() {
        return new Query(rel, href, title, null, fields);
    }

    public Template toTemplate() {
        return toTemplate(null);
    }

    /**
     * Converts to a template, applying default values by field name.
     * <p>
     * A supplied default replaces the field value only when it is truthy (see
     * {@link Values#isTruthy(Object)}): {@code false}, {@code 0} and empty strings leave the
     * schema-declared default in place. Enum constants are normalized to their name.
     * </p>
     *
     * @param defaults default values by field name, or {@code null}
     */
    public Template toTemplate(Map<String, ?> defaults) {
        List<FieldDescriptor> data = new ArrayList<>(fields.size());
        for (FieldDescriptor field : fields) {
            Object supplied = defaults == null ? null : Values.scalar(defaults.get(field.name()));
            data.add(Values.isTruthy(supplied) ? field.withValue(supplied) : field);
        }
        return new Template(name, data, href, method, title, rel);
    }
}
