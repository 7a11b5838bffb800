package io.github.cyfko.hypermedia.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * A single element of a collection: its URI, its data fields and its own links.
 *
 * @param href  URI of the item (may be empty)
 * @param rel   relation of the item, {@code item} by default
 * @param data  ordered data fields
 * @param links links attached to the item
 *
 * @author cyfko
 * @since 1.0
 */
@JsonPropertyOrder({"href", "rel", "data", "links"})
public record Item(
        String href,
        String rel,
        List<FieldDescriptor> data,
        List<Link> links
) {

    public static final String DEFAULT_REL = "item";

    public Item {
        href = href == null ? "" : href;
        rel = rel == null ? DEFAULT_REL : rel;
        data = data == null ? List.of() : List.copyOf(data);
        links = links == null ? List.of() : List.copyOf(links);
    }

    public Item(String href, List<FieldDescriptor> data) {
        this(href, DEFAULT_REL, data, List.of());
    }

    /**
     * Looks up a data field by name.
     *
     * @param name field name
     * @return the field, or {@code null} when absent
     */
    public FieldDescriptor field(String name) {
        for (FieldDescriptor field : data) {
            if (field.name().equals(name)) {
                return field;
            }
        }
        return null;
    }
}
