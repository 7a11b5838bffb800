package io.github.cyfko.hypermedia.core.catalog;

import io.github.cyfko.hypermedia.core.model.FieldDescriptor;

import java.util.List;
import java.util.Objects;

/**
 * One row of the transition catalog: the metadata of a named API operation.
 * <p>
 * The {@code href} is the unsubstituted path template; its {@code {placeholders}} are exactly the
 * path parameters of the operation. Path parameters are never part of {@code fields}: they are URL
 * placeholders, not user-editable data. {@code fields} keeps the declaration order of the query
 * parameters followed by the body schema properties.
 * </p>
 *
 * @param name   operation name (primary key of the catalog)
 * @param href   path template, e.g. {@code /items/{item_id}}
 * @param rel    default relation: the space-joined operation tags, empty when untagged
 * @param title  human summary of the operation, empty when none
 * @param method upper-case HTTP method
 * @param fields ordered field descriptors
 *
 * @author cyfko
 * @since 1.0
 */
public record Transition(
        String name,
        String href,
        String rel,
        String title,
        String method,
        List<FieldDescriptor> fields
) {

    public Transition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(href, "href");
        rel = rel == null ? "" : rel;
        title = title == null ? "" : title;
        method = method == null ? "GET" : method;
        fields = fields == null ? List.of() : List.copyOf(fields);
    }

    /**
     * The operation tags as a space-joined string. Same value as the default relation.
     */
    public String tags() {
        return rel;
    }
}
