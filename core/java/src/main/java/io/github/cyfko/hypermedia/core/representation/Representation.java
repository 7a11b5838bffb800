package io.github.cyfko.hypermedia.core.representation;

import io.github.cyfko.hypermedia.core.model.CollectionDocument;

import java.util.Objects;

/**
 * Outcome of content negotiation: the media type to answer with and the body.
 * <p>
 * The body is either the {@link CollectionDocument} itself (to be serialized as JSON) or a
 * {@link String} of rendered markup.
 * </p>
 *
 * @param mediaType response media type
 * @param body      the document or the markup
 *
 * @author cyfko
 * @since 1.0
 */
public record Representation(String mediaType, Object body) {

    public Representation {
        Objects.requireNonNull(mediaType, "mediaType");
        Objects.requireNonNull(body, "body");
    }

    public static Representation document(CollectionDocument document, String mediaType) {
        return new Representation(mediaType, document);
    }

    public static Representation markup(String markup, String mediaType) {
        return new Representation(mediaType, markup);
    }

    public boolean isDocument() {
        return body instanceof CollectionDocument;
    }
}
