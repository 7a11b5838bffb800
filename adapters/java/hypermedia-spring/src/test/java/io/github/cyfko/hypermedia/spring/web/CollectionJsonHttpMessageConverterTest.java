package io.github.cyfko.hypermedia.spring.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.hypermedia.core.json.CollectionJsonWriter;
import io.github.cyfko.hypermedia.core.model.Collection;
import io.github.cyfko.hypermedia.core.model.CollectionDocument;
import io.github.cyfko.hypermedia.core.model.Link;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.http.MockHttpOutputMessage;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CollectionJsonHttpMessageConverterTest {

    private static final MediaType COLLECTION_JSON = MediaType.parseMediaType("application/vnd.collection+json");

    private final CollectionJsonHttpMessageConverter converter =
            new CollectionJsonHttpMessageConverter(CollectionJsonWriter.createMapper(), COLLECTION_JSON.toString());

    @Test
    @DisplayName("Writes documents only, in the hypermedia media type")
    void writability() {
        assertTrue(converter.canWrite(CollectionDocument.class, COLLECTION_JSON));
        assertFalse(converter.canWrite(CollectionDocument.class, MediaType.TEXT_HTML));
        assertFalse(converter.canWrite(Map.class, COLLECTION_JSON));
        assertFalse(converter.canRead(CollectionDocument.class, COLLECTION_JSON));
    }

    @Test
    @DisplayName("Serialized document carries the content type and Collection+JSON members")
    void writesDocument() throws Exception {
        // Given
        CollectionDocument document = new CollectionDocument(
                new Collection("/tasks", "Tasks", List.of(new Link("self", "/tasks")), List.of(), List.of()));
        MockHttpOutputMessage output = new MockHttpOutputMessage();

        // When
        converter.write(document, COLLECTION_JSON, output);

        // Then
        assertTrue(COLLECTION_JSON.isCompatibleWith(output.getHeaders().getContentType()));
        JsonNode json = new ObjectMapper().readTree(output.getBodyAsString());
        assertEquals("self", json.get("collection").get("links").get(0).get("rel").asText());
        assertFalse(json.has("template"));
    }
}
