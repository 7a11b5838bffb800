package io.github.cyfko.hypermedia.core.catalog;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable, name-indexed table of transitions together with the handler-identity mapping
 * built alongside it.
 * <p>
 * A catalog is safe for concurrent reads: it is never modified after construction.
 * </p>
 *
 * @author cyfko
 * @since 1.0
 */
public final class TransitionCatalog {

    private final Map<String, Transition> transitions;
    private final Map<Object, String> handles;

    /**
     * @param transitions transitions by name, in discovery order
     * @param handles     handler identities mapped to the operation name they implement
     */
    public TransitionCatalog(Map<String, Transition> transitions, Map<?, String> handles) {
        this.transitions = Collections.unmodifiableMap(new LinkedHashMap<>(transitions));
        this.handles = handles == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(handles));
    }

    public Optional<Transition> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(transitions.get(name));
    }

    /**
     * Maps a handler identity to the name of the operation it implements.
     *
     * @param handle handler identity
     * @return the operation name, or empty when the handle is unknown
     */
    public Optional<String> nameOf(Object handle) {
        if (handle == null) return Optional.empty();
        return Optional.ofNullable(handles.get(handle));
    }

    public boolean contains(String name) {
        return transitions.containsKey(name);
    }

    public Set<String> names() {
        return transitions.keySet();
    }

    public Map<String, Transition> asMap() {
        return transitions;
    }

    public int size() {
        return transitions.size();
    }

    @Override
    public String toString() {
        return "TransitionCatalog[transitions=" + transitions.size() + ", handles=" + handles.size() + "]";
    }
}
