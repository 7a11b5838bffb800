package io.github.cyfko.hypermedia.core.projection;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Customizes how a record component or field is presented when projected into item data.
 *
 * <pre>{@code
 * public record Task(
 *     long id,
 *     @DisplayedAs("Task title") String title,
 *     @DisplayedAs(value = "Notes", renderHint = "textarea") String notes) { }
 * }</pre>
 *
 * @author cyfko
 * @since 1.0
 */
@Target({ElementType.RECORD_COMPONENT, ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface DisplayedAs {

    /**
     * Human readable title used as the prompt. Empty means "derive from the name".
     */
    String value() default "";

    /**
     * Opaque rendering hint passed through to clients (e.g. {@code textarea}). Empty means none.
     */
    String renderHint() default "";
}
