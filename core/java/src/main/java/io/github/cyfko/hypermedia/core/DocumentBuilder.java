package io.github.cyfko.hypermedia.core;

import io.github.cyfko.hypermedia.core.model.CollectionDocument;
import io.github.cyfko.hypermedia.core.model.ErrorInfo;
import io.github.cyfko.hypermedia.core.model.Item;
import io.github.cyfko.hypermedia.core.model.Link;
import io.github.cyfko.hypermedia.core.model.Query;
import io.github.cyfko.hypermedia.core.model.Template;
import io.github.cyfko.hypermedia.core.resolution.TransitionRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Fluent declaration of a document, obtained from {@link Hypermedia#document(String)}.
 * <p>
 * Items, links, queries and templates keep their declaration order. {@link #build()} resolves the
 * declared references with the same rules as {@link Hypermedia#buildDocument}.
 * </p>
 *
 * @author cyfko
 * @since 1.0
 */
public final class DocumentBuilder {

    private final Hypermedia hypermedia;
    private final String title;
    private final List<Item> items = new ArrayList<>();
    private final List<TransitionRef> links = new ArrayList<>();
    private final List<TransitionRef> queries = new ArrayList<>();
    private final List<TransitionRef> templates = new ArrayList<>();
    private String href;
    private ErrorInfo error;

    DocumentBuilder(Hypermedia hypermedia, String title) {
        this.hypermedia = hypermedia;
        this.title = Objects.requireNonNull(title, "title");
    }

    public DocumentBuilder href(String href) {
        this.href = href;
        return this;
    }

    public DocumentBuilder item(Item item) {
        items.add(Objects.requireNonNull(item, "item"));
        return this;
    }

    public DocumentBuilder item(Object record, String href, List<Link> links) {
        items.add(hypermedia.item(record, href, links));
        return this;
    }

    /**
     * Adds several items. Prebuilt {@link Item}s are kept as they are; other values are projected
     * with the href computed by {@code itemHref}.
     */
    public <T> DocumentBuilder items(List<T> records, Function<? super T, String> itemHref) {
        for (T record : records) {
            if (record instanceof Item prebuilt) {
                items.add(prebuilt);
            } else {
                items.add(hypermedia.item(record, itemHref == null ? "" : itemHref.apply(record), List.of()));
            }
        }
        return this;
    }

    public DocumentBuilder link(TransitionRef ref) {
        links.add(Objects.requireNonNull(ref, "ref"));
        return this;
    }

    public DocumentBuilder link(String name) {
        return link(TransitionRef.of(name));
    }

    public DocumentBuilder link(String name, String rel) {
        return link(TransitionRef.of(name, rel));
    }

    public DocumentBuilder link(String name, Map<String, ?> params) {
        return link(TransitionRef.of(name, params));
    }

    public DocumentBuilder link(Link link) {
        return link(TransitionRef.prebuilt(link));
    }

    public DocumentBuilder query(TransitionRef ref) {
        queries.add(Objects.requireNonNull(ref, "ref"));
        return this;
    }

    public DocumentBuilder query(String name) {
        return query(TransitionRef.of(name));
    }

    public DocumentBuilder query(String name, String rel) {
        return query(TransitionRef.of(name, rel));
    }

    public DocumentBuilder query(Query query) {
        return query(TransitionRef.prebuilt(query));
    }

    public DocumentBuilder template(TransitionRef ref) {
        templates.add(Objects.requireNonNull(ref, "ref"));
        return this;
    }

    public DocumentBuilder template(String name) {
        return template(TransitionRef.of(name));
    }

    public DocumentBuilder template(String name, String rel) {
        return template(TransitionRef.of(name, rel));
    }

    public DocumentBuilder template(Template template) {
        return template(TransitionRef.prebuilt(template));
    }

    public DocumentBuilder error(ErrorInfo error) {
        this.error = error;
        return this;
    }

    public CollectionDocument build() {
        return hypermedia.buildDocument(title, href, items, null, links, queries, templates, error);
    }
}
