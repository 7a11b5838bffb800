package io.github.cyfko.hypermedia.core.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * The collection part of a document.
 *
 * @param version Collection+JSON version, always {@value #VERSION}
 * @param href    URI of the collection
 * @param title   title of the collection
 * @param links   ordered links
 * @param items   ordered items
 * @param queries ordered queries
 *
 * @author cyfko
 * @since 1.0
 */
@JsonPropertyOrder({"version", "href", "title", "links", "items", "queries"})
public record Collection(
        String version,
        String href,
        String title,
        List<Link> links,
        List<Item> items,
        List<Query> queries
) {

    public static final String VERSION = "1.0";

    public Collection {
        Objects.requireNonNull(href, "href");
        Objects.requireNonNull(title, "title");
        version = VERSION;
        links = links == null ? List.of() : List.copyOf(links);
        items = items == null ? List.of() : List.copyOf(items);
        queries = queries == null ? List.of() : List.copyOf(queries);
    }

    public Collection(String href, String title, List<Link> links, List<Item> items, List<Query> queries) {
        this(VERSION, href, title, links, items, queries);
    }
}
