package io.github.cyfko.hypermedia.core.resolution;

import io.github.cyfko.hypermedia.core.model.Affordance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A reference to a transition as accepted by document assembly.
 * <p>
 * Every variant except {@link Prebuilt} is resolved against the catalog; {@link Prebuilt} carries
 * an already-built {@link Affordance} that is passed through unchanged.
 * </p>
 *
 * <pre>{@code
 * TransitionRef.of("list_items");                                  // ByName
 * TransitionRef.of("list_items", "self");                          // ByNameAndRelation
 * TransitionRef.of("view_item", Map.of("item_id", 7));             // ByNameAndParams
 * TransitionRef.of("view_item", "item", Map.of("item_id", 7));     // ByNameRelationParams
 * TransitionRef.handle(controllerMethod);                          // ByHandle
 * TransitionRef.handle(viewMethod, "item", Map.of("item_id", 7));  // ByHandle with relation and params
 * TransitionRef.prebuilt(new Link("home", "/"));                   // Prebuilt
 * }</pre>
 * <p>
 * Parameter maps are copied; {@code null} values are kept and substituted as {@code "null"}.
 * </p>
 *
 * @author cyfko
 * @since 1.0
 */
public sealed interface TransitionRef {

    record ByName(String name) implements TransitionRef {
        public ByName {
            Objects.requireNonNull(name, "name");
        }
    }

    record ByNameAndRelation(String name, String rel) implements TransitionRef {
        public ByNameAndRelation {
            Objects.requireNonNull(name, "name");
        }
    }

    record ByNameAndParams(String name, Map<String, ?> params) implements TransitionRef {
        public ByNameAndParams {
            Objects.requireNonNull(name, "name");
            params = copy(params);
        }
    }

    record ByNameRelationParams(String name, String rel, Map<String, ?> params) implements TransitionRef {
        public ByNameRelationParams {
            Objects.requireNonNull(name, "name");
            params = copy(params);
        }
    }

    record ByHandle(Object handle, String rel, Map<String, ?> params) implements TransitionRef {
        public ByHandle {
            Objects.requireNonNull(handle, "handle");
            params = copy(params);
        }
    }

    record Prebuilt(Affordance representation) implements TransitionRef {
        public Prebuilt {
            Objects.requireNonNull(representation, "representation");
        }
    }

    static TransitionRef of(String name) {
        return new ByName(name);
    }

    static TransitionRef of(String name, String rel) {
        return new ByNameAndRelation(name, rel);
    }

    static TransitionRef of(String name, Map<String, ?> params) {
        return new ByNameAndParams(name, params);
    }

    static TransitionRef of(String name, String rel, Map<String, ?> params) {
        return new ByNameRelationParams(name, rel, params);
    }

    static TransitionRef handle(Object handle) {
        return new ByHandle(handle, null, null);
    }

    static TransitionRef handle(Object handle, String rel) {
        return new ByHandle(handle, rel, null);
    }

    static TransitionRef handle(Object handle, Map<String, ?> params) {
        return new ByHandle(handle, null, params);
    }

    static TransitionRef handle(Object handle, String rel, Map<String, ?> params) {
        return new ByHandle(handle, rel, params);
    }

    static TransitionRef prebuilt(Affordance representation) {
        return new Prebuilt(representation);
    }

    private static Map<String, ?> copy(Map<String, ?> params) {
        return params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}
