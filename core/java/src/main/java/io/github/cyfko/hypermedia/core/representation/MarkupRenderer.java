package io.github.cyfko.hypermedia.core.representation;

/**
 * External collaborator producing human-readable markup for clients that did not ask for the
 * hypermedia media type (typically browsers).
 * <p>
 * Implementations usually delegate to a template engine. Whatever they throw is propagated to the
 * caller unchanged.
 * </p>
 *
 * @author cyfko
 * @since 1.0
 */
@FunctionalInterface
public interface MarkupRenderer {

    /**
     * @param model title, links, items, queries and templates to render
     * @return the rendered markup
     */
    String render(RenderModel model);
}
