package io.github.cyfko.hypermedia.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A data submission form descriptor.
 *
 * @param name   template name (the operation name for resolved templates)
 * @param data   ordered template fields
 * @param href   submission target, or {@code null}
 * @param method HTTP method, {@code POST} when not given
 * @param prompt human readable label, or {@code null}
 * @param rel    relation, or {@code null}
 *
 * @author cyfko
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "data", "href", "method", "prompt", "rel"})
public record Template(
        String name,
        List<FieldDescriptor> data,
        String href,
        String method,
        String prompt,
        String rel
) implements Affordance {

    public static final String DEFAULT_METHOD = "POST";

    public Template {
        Objects.requireNonNull(name, "name");
        data = data == null ? List.of() : data.stream().map(FieldDescriptor::asTemplateField).toList();
        method = method == null ? DEFAULT_METHOD : method;
    }

    public Template(String name, List<FieldDescriptor> data) {
        this(name, data, null, DEFAULT_METHOD, null, null);
    }

    public Template withRel(String newRel) {
        return new Template(name, data, href, method, prompt, newRel);
    }
}
