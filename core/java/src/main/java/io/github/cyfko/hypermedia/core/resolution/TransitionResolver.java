package io.github.cyfko.hypermedia.core.resolution;

import io.github.cyfko.hypermedia.core.catalog.Transition;
import io.github.cyfko.hypermedia.core.catalog.TransitionCatalog;
import io.github.cyfko.hypermedia.core.catalog.TransitionRegistry;
import io.github.cyfko.hypermedia.core.exception.MissingParameterException;
import io.github.cyfko.hypermedia.core.utils.PathTemplates;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Looks up transitions by name or handler identity and substitutes their path placeholders.
 *
 * <h2>Resolution Rules</h2>
 * <ul>
 *   <li>An unknown name or handle resolves to {@link Optional#empty()}; callers omit it.</li>
 *   <li>Every {@code {placeholder}} of the path template must have a context entry, otherwise a
 *       {@link MissingParameterException} is thrown.</li>
 *   <li>Extra context entries are ignored.</li>
 *   <li>The cached catalog row is never modified; each call returns a new {@link ResolvedTransition}.</li>
 * </ul>
 *
 * <pre>{@code
 * resolver.resolve("view_item", Map.of("item_id", "42"))
 *         .map(ResolvedTransition::toLink);      // Link[rel=..., href=/items/42, ...]
 * }</pre>
 *
 * @author cyfko
 * @since 1.0
 */
public class TransitionResolver {

    private final TransitionRegistry registry;

    public TransitionResolver(TransitionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Resolves a transition by operation name.
     *
     * @param name    operation name
     * @param context placeholder values
     * @return the resolved transition, or empty when no operation has that name
     * @throws MissingParameterException when a placeholder has no context value
     */
    public Optional<ResolvedTransition> resolve(String name, Map<String, ?> context) {
        Optional<Transition> transition = registry.catalog().find(name);
        return transition.map(t -> ResolvedTransition.of(t, PathTemplates.expand(t.href(), context, t.name())));
    }

    /**
     * Resolves a transition by handler identity, falling back to a name lookup for strings.
     *
     * @param handle  handler identity previously associated with an operation name, or a name
     * @param context placeholder values
     * @return the resolved transition, or empty when the handle is unknown
     * @throws MissingParameterException when a placeholder has no context value
     */
    public Optional<ResolvedTransition> resolveHandle(Object handle, Map<String, ?> context) {
        if (handle instanceof String name) {
            return resolve(name, context);
        }
        TransitionCatalog catalog = registry.catalog();
        return catalog.nameOf(handle).flatMap(name -> resolve(name, context));
    }

    public TransitionRegistry registry() {
        return registry;
    }
}
