package io.github.cyfko.hypermedia.core.representation;

import io.github.cyfko.hypermedia.core.config.HypermediaConfig;
import io.github.cyfko.hypermedia.core.model.CollectionDocument;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Chooses between the structured document and rendered markup for a response.
 *
 * <h2>Negotiation</h2>
 * <p>
 * The {@code Accept} value is split on commas and each token is trimmed. If any token equals the
 * hypermedia media type exactly, the document is returned as is. Token order and quality weights
 * are not considered: presence anywhere in the list is enough. Otherwise the document is handed to
 * the {@link MarkupRenderer}. Without a renderer the document is returned regardless.
 * </p>
 *
 * <pre>{@code
 * representor.represent(doc, "text/html, application/vnd.collection+json"); // document
 * representor.represent(doc, "text/html");                                   // markup
 * }</pre>
 *
 * @author cyfko
 * @since 1.0
 */
public class Representor {

    private static final Logger logger = Logger.getLogger(Representor.class.getName());

    public static final String TEXT_HTML = "text/html";

    private final String mediaType;
    private final MarkupRenderer renderer;

    /**
     * @param config   configuration providing the hypermedia media type
     * @param renderer markup renderer, or {@code null} to always answer with the document
     */
    public Representor(HypermediaConfig config, MarkupRenderer renderer) {
        this.mediaType = Objects.requireNonNull(config, "config").getMediaType();
        this.renderer = renderer;
    }

    public Representation represent(CollectionDocument document, String acceptHeader) {
        Objects.requireNonNull(document, "document");
        if (accepts(acceptHeader, mediaType)) {
            return Representation.document(document, mediaType);
        }
        if (renderer == null) {
            logger.fine(() -> "No markup renderer configured, answering '" + acceptHeader + "' with " + mediaType);
            return Representation.document(document, mediaType);
        }
        return Representation.markup(renderer.render(RenderModel.of(document)), TEXT_HTML);
    }

    /**
     * Tells whether an {@code Accept} value lists the given media type as one of its tokens.
     */
    public static boolean accepts(String acceptHeader, String mediaType) {
        if (acceptHeader == null || acceptHeader.isEmpty()) {
            return false;
        }
        for (String token : acceptHeader.split(",")) {
            if (token.trim().equals(mediaType)) {
                return true;
            }
        }
        return false;
    }

    public String getMediaType() {
        return mediaType;
    }
}
