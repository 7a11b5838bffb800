package io.github.cyfko.hypermedia.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A plain navigational reference.
 *
 * @param rel       link relation
 * @param href      target URI
 * @param prompt    human readable label, or {@code null}
 * @param render    rendering mode ({@code link} or {@code image}), or {@code null}
 * @param mediaType expected media type of the target, or {@code null}
 * @param method    HTTP method, {@code GET} when not given
 *
 * @author cyfko
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"rel", "href", "prompt", "render", "media_type", "method"})
public record Link(
        String rel,
        String href,
        String prompt,
        String render,
        @JsonProperty("media_type") String mediaType,
        String method
) implements Affordance {

    public static final String DEFAULT_METHOD = "GET";

    public Link {
        Objects.requireNonNull(rel, "rel");
        Objects.requireNonNull(href, "href");
        method = method == null ? DEFAULT_METHOD : method;
    }

    public Link(String rel, String href) {
        this(rel, href, null, null, null, DEFAULT_METHOD);
    }

    public Link(String rel, String href, String prompt, String method) {
        this(rel, href, prompt, null, null, method);
    }

    public Link withRel(String newRel) {
        return new Link(newRel, href, prompt, render, mediaType, method);
    }
}
