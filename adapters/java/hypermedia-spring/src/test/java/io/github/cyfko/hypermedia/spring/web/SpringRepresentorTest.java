package io.github.cyfko.hypermedia.spring.web;

import io.github.cyfko.hypermedia.core.config.HypermediaConfig;
import io.github.cyfko.hypermedia.core.model.Collection;
import io.github.cyfko.hypermedia.core.model.CollectionDocument;
import io.github.cyfko.hypermedia.core.model.ErrorInfo;
import io.github.cyfko.hypermedia.core.representation.Representor;
import io.github.cyfko.hypermedia.core.spi.RequestContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SpringRepresentorTest {

    private static final CollectionDocument DOCUMENT = new CollectionDocument(
            new Collection("/tasks", "Tasks", List.of(), List.of(), List.of()));

    private static SpringRepresentor representor(String accept) {
        Representor core = new Representor(HypermediaConfig.defaults(), model -> "<h1>" + model.title() + "</h1>");
        return new SpringRepresentor(core, RequestContext.of("/tasks", accept));
    }

    @Test
    @DisplayName("Hypermedia clients receive the document with the hypermedia content type")
    void documentResponse() {
        ResponseEntity<Object> response = representor("application/vnd.collection+json").respond(DOCUMENT);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(MediaType.parseMediaType("application/vnd.collection+json"), response.getHeaders().getContentType());
        assertSame(DOCUMENT, response.getBody());
    }

    @Test
    @DisplayName("Browsers receive rendered markup")
    void markupResponse() {
        ResponseEntity<Object> response = representor("text/html,application/xhtml+xml").respond(DOCUMENT);

        assertEquals(MediaType.TEXT_HTML, response.getHeaders().getContentType());
        assertEquals("<h1>Tasks</h1>", response.getBody());
    }

    @Test
    @DisplayName("Error documents use their code as status")
    void errorStatus() {
        CollectionDocument notFound = new CollectionDocument(
                new Collection("/tasks/9", "Task", List.of(), List.of(), List.of()), null,
                new ErrorInfo("Not Found", 404, "No task 9"));

        ResponseEntity<Object> response = representor("application/vnd.collection+json").respond(notFound);

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
    }

    @Test
    @DisplayName("Explicit status overrides the default")
    void explicitStatus() {
        ResponseEntity<Object> response = representor("application/vnd.collection+json")
                .respond(DOCUMENT, HttpStatus.CREATED);

        assertEquals(HttpStatus.CREATED, response.getStatusCode());
    }
}
