package io.github.cyfko.hypermedia.core.model;

/**
 * Marker for the three renderings of a transition: {@link Link}, {@link Query} and {@link Template}.
 * <p>
 * Allows already-built representations to be passed wherever a transition reference is accepted.
 * </p>
 *
 * @author cyfko
 * @since 1.0
 */
public sealed interface Affordance permits Link, Query, Template {
}
