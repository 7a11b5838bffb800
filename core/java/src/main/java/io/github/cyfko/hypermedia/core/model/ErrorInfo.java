package io.github.cyfko.hypermedia.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Error details carried by a document.
 *
 * @param title   short summary
 * @param code    numeric code (usually the HTTP status)
 * @param message explanation
 * @param details additional details, or {@code null}
 *
 * @author cyfko
 * @since 1.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"title", "code", "message", "details"})
public record ErrorInfo(String title, int code, String message, String details) {

    public ErrorInfo {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(message, "message");
    }

    public ErrorInfo(String title, int code, String message) {
        this(title, code, message, null);
    }
}
