package io.github.cyfko.hypermedia.core;

import io.github.cyfko.hypermedia.core.exception.MissingParameterException;
import io.github.cyfko.hypermedia.core.model.Affordance;
import io.github.cyfko.hypermedia.core.model.Collection;
import io.github.cyfko.hypermedia.core.model.CollectionDocument;
import io.github.cyfko.hypermedia.core.model.ErrorInfo;
import io.github.cyfko.hypermedia.core.model.Item;
import io.github.cyfko.hypermedia.core.model.Link;
import io.github.cyfko.hypermedia.core.model.Query;
import io.github.cyfko.hypermedia.core.model.Template;
import io.github.cyfko.hypermedia.core.projection.RecordProjector;
import io.github.cyfko.hypermedia.core.resolution.ResolvedTransition;
import io.github.cyfko.hypermedia.core.resolution.TransitionRef;
import io.github.cyfko.hypermedia.core.resolution.TransitionResolver;
import io.github.cyfko.hypermedia.core.spi.RequestContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/**
 * High-level facade assembling Collection+JSON documents from transition references and domain values.
 * <p>
 * Links, queries and templates are declared as {@link TransitionRef}s: by operation name, with a
 * relation, with path parameters, by handler identity, or as already-built objects. References are
 * resolved through the {@link TransitionResolver}; items are projected through the
 * {@link RecordProjector}.
 * </p>
 *
 * <h2>Assembly Rules</h2>
 * <ul>
 *   <li>{@code href} defaults to the current request URL.</li>
 *   <li>References that do not resolve (unknown name or handle) are dropped from the output.</li>
 *   <li>A {@link MissingParameterException} raised while resolving is always propagated.</li>
 *   <li>An empty template list is omitted from the document.</li>
 *   <li>A non-empty relation in a reference replaces the transition's default relation.</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * CollectionDocument doc = hypermedia.document("Tasks")
 *     .items(tasks, task -> "/tasks/" + task.id())
 *     .link("list_tasks", "self")
 *     .link(TransitionRef.of("view_task", Map.of("task_id", 1)))
 *     .query("search_tasks")
 *     .template("create_task")
 *     .build();
 * }</pre>
 *
 * @author cyfko
 * @since 1.0
 */
public class Hypermedia {

    private static final Logger logger = Logger.getLogger(Hypermedia.class.getName());

    private final TransitionResolver resolver;
    private final RecordProjector projector;
    private final RequestContext requestContext;

    public Hypermedia(TransitionResolver resolver, RecordProjector projector, RequestContext requestContext) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.projector = Objects.requireNonNull(projector, "projector");
        this.requestContext = Objects.requireNonNull(requestContext, "requestContext");
    }

    /**
     * Starts a fluent document declaration.
     *
     * @param title collection title
     */
    public DocumentBuilder document(String title) {
        return new DocumentBuilder(this, title);
    }

    /**
     * Builds a complete document.
     *
     * @param title     collection title
     * @param href      collection URI, or {@code null} or empty for the current request URL
     * @param items     prebuilt {@link Item}s or domain values to project, or {@code null}
     * @param itemHref  computes the href of projected values, or {@code null} for empty hrefs
     * @param links     link references, or {@code null}
     * @param queries   query references, or {@code null}
     * @param templates template references, or {@code null}
     * @param error     error details, or {@code null}
     * @return the assembled document
     * @throws MissingParameterException when a reference lacks a path parameter
     * @throws IllegalArgumentException  when a prebuilt reference has the wrong kind
     */
    public CollectionDocument buildDocument(String title,
                                            String href,
                                            List<?> items,
                                            Function<Object, String> itemHref,
                                            List<TransitionRef> links,
                                            List<TransitionRef> queries,
                                            List<TransitionRef> templates,
                                            ErrorInfo error) {
        Objects.requireNonNull(title, "title");
        String documentHref = href != null && !href.isEmpty() ? href : requestContext.currentUrl();

        Collection collection = new Collection(
                documentHref == null ? "" : documentHref,
                title,
                processLinks(links),
                processItems(items, itemHref),
                processQueries(queries));
        return new CollectionDocument(collection, processTemplates(templates), error);
    }

    /**
     * Projects a single domain value into an item.
     */
    public Item item(Object record, String href, List<Link> links) {
        return projector.project(record, href, links);
    }

    public TransitionResolver resolver() {
        return resolver;
    }

    public RequestContext requestContext() {
        return requestContext;
    }

    List<Item> processItems(List<?> items, Function<Object, String> itemHref) {
        List<Item> result = new ArrayList<>();
        if (items == null) return result;
        for (Object item : items) {
            Objects.requireNonNull(item, "item");
            if (item instanceof Item prebuilt) {
                result.add(prebuilt);
            } else {
                String href = itemHref != null ? itemHref.apply(item) : "";
                result.add(projector.project(item, href, List.of()));
            }
        }
        return result;
    }

    List<Link> processLinks(List<TransitionRef> refs) {
        List<Link> result = new ArrayList<>();
        if (refs == null) return result;
        for (TransitionRef ref : refs) {
            if (ref instanceof TransitionRef.Prebuilt prebuilt) {
                result.add(expect(prebuilt, Link.class));
                continue;
            }
            Resolution resolution = resolve(ref);
            resolution.transition().ifPresent(t -> result.add(t.toLink(resolution.rel())));
        }
        return result;
    }

    List<Query> processQueries(List<TransitionRef> refs) {
        List<Query> result = new ArrayList<>();
        if (refs == null) return result;
        for (TransitionRef ref : refs) {
            if (ref instanceof TransitionRef.Prebuilt prebuilt) {
                result.add(expect(prebuilt, Query.class));
                continue;
            }
            Resolution resolution = resolve(ref);
            resolution.transition().ifPresent(t -> {
                Query query = t.toQuery();
                result.add(resolution.hasRel() ? query.withRel(resolution.rel()) : query);
            });
        }
        return result;
    }

    List<Template> processTemplates(List<TransitionRef> refs) {
        List<Template> result = new ArrayList<>();
        if (refs == null) return result;
        for (TransitionRef ref : refs) {
            if (ref instanceof TransitionRef.Prebuilt prebuilt) {
                result.add(expect(prebuilt, Template.class));
                continue;
            }
            Resolution resolution = resolve(ref);
            resolution.transition().ifPresent(t -> {
                Template template = t.toTemplate();
                result.add(resolution.hasRel() ? template.withRel(resolution.rel()) : template);
            });
        }
        return result;
    }

    private Resolution resolve(TransitionRef ref) {
        Objects.requireNonNull(ref, "ref");
        Resolution resolution;
        if (ref instanceof TransitionRef.ByName r) {
            resolution = new Resolution(resolver.resolve(r.name(), Map.of()), null);
        } else if (ref instanceof TransitionRef.ByNameAndRelation r) {
            resolution = new Resolution(resolver.resolve(r.name(), Map.of()), r.rel());
        } else if (ref instanceof TransitionRef.ByNameAndParams r) {
            resolution = new Resolution(resolver.resolve(r.name(), r.params()), null);
        } else if (ref instanceof TransitionRef.ByNameRelationParams r) {
            resolution = new Resolution(resolver.resolve(r.name(), r.params()), r.rel());
        } else if (ref instanceof TransitionRef.ByHandle r) {
            resolution = new Resolution(resolver.resolveHandle(r.handle(), r.params()), r.rel());
        } else {
            throw new IllegalArgumentException("Unsupported transition reference: " + ref);
        }
        if (resolution.transition().isEmpty()) {
            logger.fine(() -> "Dropping unresolvable transition reference " + ref);
        }
        return resolution;
    }

    private static <T extends Affordance> T expect(TransitionRef.Prebuilt prebuilt, Class<T> kind) {
        Affordance representation = prebuilt.representation();
        if (!kind.isInstance(representation)) {
            throw new IllegalArgumentException("Expected a prebuilt " + kind.getSimpleName() + " but got "
                    + representation.getClass().getSimpleName());
        }
        return kind.cast(representation);
    }

    private record Resolution(Optional<ResolvedTransition> transition, String rel) {
        boolean hasRel() {
            return rel != null && !rel.isEmpty();
        }
    }
}
