package io.github.cyfko.hypermedia.sample;

import io.github.cyfko.hypermedia.core.projection.DisplayedAs;

/**
 * A tracked task.
 *
 * @param id       identifier
 * @param title    short title
 * @param notes    free text
 * @param priority priority
 * @param done     completion flag
 */
public record Task(
        long id,
        String title,
        @DisplayedAs(value = "Notes", renderHint = "textarea") String notes,
        Priority priority,
        boolean done
) {
}
