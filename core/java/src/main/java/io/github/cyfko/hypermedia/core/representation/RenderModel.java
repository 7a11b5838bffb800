package io.github.cyfko.hypermedia.core.representation;

import io.github.cyfko.hypermedia.core.model.CollectionDocument;
import io.github.cyfko.hypermedia.core.model.Item;
import io.github.cyfko.hypermedia.core.model.Link;
import io.github.cyfko.hypermedia.core.model.Query;
import io.github.cyfko.hypermedia.core.model.Template;

import java.util.List;

/**
 * What a {@link MarkupRenderer} receives: the parts of a document a human-readable page shows.
 *
 * @param title     collection title
 * @param links     collection links
 * @param items     collection items
 * @param queries   collection queries
 * @param templates document templates (empty when the document has none)
 */
public record RenderModel(
        String title,
        List<Link> links,
        List<Item> items,
        List<Query> queries,
        List<Template> templates
) {

    public static RenderModel of(CollectionDocument document) {
        return new RenderModel(
                document.collection().title(),
                document.collection().links(),
                document.collection().items(),
                document.collection().queries(),
                document.hasTemplates() ? document.templates() : List.of());
    }
}
