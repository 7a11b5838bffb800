package io.github.cyfko.hypermedia.spring.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.hypermedia.core.model.CollectionDocument;
import org.springframework.http.MediaType;
import org.springframework.http.converter.json.AbstractJackson2HttpMessageConverter;

import java.lang.reflect.Type;

/**
 * Write-only Jackson converter for {@link CollectionDocument}s in the hypermedia media type.
 * <p>
 * Not a {@code MappingJackson2HttpMessageConverter}: Spring Boot keeps its default JSON converter
 * only while no bean of that type exists.
 * </p>
 *
 * @author cyfko
 * @since 1.0
 */
public class CollectionJsonHttpMessageConverter extends AbstractJackson2HttpMessageConverter {

    public CollectionJsonHttpMessageConverter(ObjectMapper objectMapper, String mediaType) {
        super(objectMapper, MediaType.parseMediaType(mediaType));
    }

    @Override
    public boolean canRead(Class<?> clazz, MediaType mediaType) {
        return false;
    }

    @Override
    public boolean canRead(Type type, Class<?> contextClass, MediaType mediaType) {
        return false;
    }

    @Override
    public boolean canWrite(Class<?> clazz, MediaType mediaType) {
        return CollectionDocument.class.isAssignableFrom(clazz) && super.canWrite(clazz, mediaType);
    }
}
