package io.github.cyfko.hypermedia.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A search form descriptor: a target URI and the parameters a client may fill in.
 *
 * @param rel    relation of the query
 * @param href   target URI
 * @param prompt human readable label, or {@code null}
 * @param name   query name, or {@code null}
 * @param data   ordered query fields
 *
 * @author cyfko
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"rel", "href", "prompt", "name", "data"})
public record Query(
        String rel,
        String href,
        String prompt,
        String name,
        List<FieldDescriptor> data
) implements Affordance {

    public Query {
        Objects.requireNonNull(rel, "rel");
        Objects.requireNonNull(href, "href");
        data = data == null ? List.of() : data.stream().map(FieldDescriptor::asQueryField).toList();
    }

    public Query withRel(String newRel) {
        return new Query(newRel, href, prompt, name, data);
    }
}
