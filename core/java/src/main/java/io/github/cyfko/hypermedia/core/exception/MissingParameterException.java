package io.github.cyfko.hypermedia.core.exception;

/**
 * Exception thrown when a transition's path template contains a placeholder that the resolution
 * context does not supply.
 * <p>
 * This signals a programming error in the caller: an operation was referenced without the path
 * data it needs. It is never swallowed by document assembly and should surface as a server error,
 * not as a missing resource.
 * </p>
 *
 * <p><strong>Example:</strong></p>
 * <pre>{@code
 * // transition "view_item" has href "/items/{item_id}"
 * resolver.resolve("view_item", Map.of());
 * // → "Missing parameter 'item_id' for transition 'view_item' with href '/items/{item_id}'"
 * }</pre>
 *
 * @author cyfko
 * @since 1.0
 */
public class MissingParameterException extends RuntimeException {

    private final String parameterName;
    private final String transitionName;
    private final String hrefTemplate;

    /**
     * Creates a new exception for the first unresolved placeholder.
     *
     * @param parameterName  name of the placeholder without braces
     * @param transitionName name of the transition being resolved
     * @param hrefTemplate   the unsubstituted path template
     */
    public MissingParameterException(String parameterName, String transitionName, String hrefTemplate) {
        super("Missing parameter '" + parameterName + "' for transition '" + transitionName
                + "' with href '" + hrefTemplate + "'");
        this.parameterName = parameterName;
        this.transitionName = transitionName;
        this.hrefTemplate = hrefTemplate;
    }

    public String parameterName() {
        return parameterName;
    }

    public String transitionName() {
        return transitionName;
    }

    public String hrefTemplate() {
        return hrefTemplate;
    }
}
