package io.github.cyfko.hypermedia.core.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.cyfko.hypermedia.core.model.CollectionDocument;

import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * Serializes documents to their Collection+JSON text form.
 * <p>
 * Null attributes are omitted and {@code java.time} values are written as ISO-8601 strings.
 * </p>
 *
 * @author cyfko
 * @since 1.0
 */
public final class CollectionJsonWriter {

    private final ObjectMapper mapper;

    public CollectionJsonWriter() {
        this(createMapper());
    }

    public CollectionJsonWriter(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Creates an {@link ObjectMapper} configured for Collection+JSON output.
     */
    public static ObjectMapper createMapper() {
        return configure(new ObjectMapper());
    }

    /**
     * Applies the Collection+JSON settings to an existing mapper.
     */
    public static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String write(CollectionDocument document) {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize Collection+JSON document", e);
        }
    }

    public ObjectMapper mapper() {
        return mapper;
    }
}
