package io.github.cyfko.hypermedia.spring.web;

import io.github.cyfko.hypermedia.core.model.CollectionDocument;
import io.github.cyfko.hypermedia.core.representation.Representation;
import io.github.cyfko.hypermedia.core.representation.Representor;
import io.github.cyfko.hypermedia.core.spi.RequestContext;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.Objects;

/**
 * Turns documents into Spring MVC responses negotiated against the current request.
 *
 * <pre>{@code
 * @GetMapping("/tasks")
 * public ResponseEntity<Object> listTasks() {
 *     return representor.respond(hypermedia.document("Tasks").link("list_tasks", "self").build());
 * }
 * }</pre>
 * <p>
 * The response status is taken from the document error code when there is one.
 * </p>
 *
 * @author cyfko
 * @since 1.0
 */
public class SpringRepresentor {

    private final Representor representor;
    private final RequestContext requestContext;

    public SpringRepresentor(Representor representor, RequestContext requestContext) {
        this.representor = Objects.requireNonNull(representor, "representor");
        this.requestContext = Objects.requireNonNull(requestContext, "requestContext");
    }

    public ResponseEntity<Object> respond(CollectionDocument document) {
        return respond(document, statusOf(document));
    }

    public ResponseEntity<Object> respond(CollectionDocument document, HttpStatusCode status) {
        return toResponse(representor.represent(document, requestContext.acceptHeader()), status);
    }

    static ResponseEntity<Object> toResponse(Representation representation, HttpStatusCode status) {
        return ResponseEntity.status(status)
                .contentType(MediaType.parseMediaType(representation.mediaType()))
                .body(representation.body());
    }

    static HttpStatusCode statusOf(CollectionDocument document) {
        if (document.error() != null && document.error().code() >= 100 && document.error().code() <= 599) {
            return HttpStatusCode.valueOf(document.error().code());
        }
        return HttpStatus.OK;
    }
}
