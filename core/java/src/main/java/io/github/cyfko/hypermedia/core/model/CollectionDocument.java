package io.github.cyfko.hypermedia.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * The complete hypermedia payload returned for one request.
 * <p>
 * An empty template list collapses to {@code null} so that "no templates" is omitted from the
 * serialized form instead of being written as an empty array.
 * </p>
 *
 * @param collection the collection (required)
 * @param templates  templates, or {@code null} when there are none
 * @param error      error details, or {@code null}
 *
 * @author cyfko
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"collection", "template", "error"})
public record CollectionDocument(
        Collection collection,
        @JsonProperty("template") List<Template> templates,
        ErrorInfo error
) {

    public CollectionDocument {
        Objects.requireNonNull(collection, "collection");
        templates = templates == null || templates.isEmpty() ? null : List.copyOf(templates);
    }

    public CollectionDocument(Collection collection) {
        this(collection, null, null);
    }

    public boolean hasTemplates() {
        return templates != null;
    }
}
