package io.github.cyfko.hypermedia.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A single named, typed and optionally labelled data slot of a Collection+JSON document.
 * <p>
 * The same shape describes item data, query parameters and template fields. The three variants
 * differ only in which optional attributes are present:
 * </p>
 * <ul>
 *   <li><strong>item</strong>: no {@code options}, no {@code required}</li>
 *   <li><strong>query</strong>: may carry {@code options}, no {@code required}</li>
 *   <li><strong>template</strong>: may carry {@code options}, always carries {@code required}</li>
 * </ul>
 * <p>
 * Instances are immutable; the {@code with*} methods return modified copies.
 * </p>
 *
 * @param name       field name, unique within its owning list
 * @param value      current or default value (scalar, structured, date/time or {@code null})
 * @param prompt     human readable prompt
 * @param type       declared type tag ({@code string}, {@code integer}, {@code number}, {@code boolean},
 *                   {@code object}, {@code array})
 * @param inputType  suggested input control ({@code text}, {@code number}, {@code checkbox}, {@code select}, ...)
 * @param renderHint opaque rendering hint passed through from the schema
 * @param options    allowed values for enumerated fields, or {@code null}
 * @param required   whether the field must be supplied (template variant only), or {@code null}
 *
 * @author cyfko
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "value", "prompt", "type", "input_type", "render_hint", "options", "required"})
public record FieldDescriptor(
        String name,
        Object value,
        String prompt,
        String type,
        @JsonProperty("input_type") String inputType,
        @JsonProperty("render_hint") String renderHint,
        List<String> options,
        Boolean required
) {

    public FieldDescriptor {
        Objects.requireNonNull(name, "name");
        options = options == null ? null : List.copyOf(options);
    }

    /**
     * Creates an item data field.
     */
    public static FieldDescriptor item(String name, Object value, String prompt, String type, String renderHint) {
        return new FieldDescriptor(name, value, prompt, type, null, renderHint, null, null);
    }

    /**
     * Returns this field in its query variant (drops {@code required}).
     */
    public FieldDescriptor asQueryField() {
        return new FieldDescriptor(name, value, prompt, type, inputType, renderHint, options, null);
    }

    /**
     * Returns this field in its template variant ({@code required} defaults to {@code false}).
     */
    public FieldDescriptor asTemplateField() {
        return new FieldDescriptor(name, value, prompt, type, inputType, renderHint, options,
                Boolean.TRUE.equals(required));
    }

    public FieldDescriptor withValue(Object newValue) {
        return new FieldDescriptor(name, newValue, prompt, type, inputType, renderHint, options, required);
    }
}
