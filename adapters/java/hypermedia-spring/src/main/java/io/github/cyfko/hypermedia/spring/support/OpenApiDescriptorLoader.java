package io.github.cyfko.hypermedia.spring.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.hypermedia.core.exception.DescriptorLoadException;
import io.swagger.v3.core.util.Json;
import io.swagger.v3.core.util.Yaml;
import io.swagger.v3.oas.models.OpenAPI;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads the OpenAPI descriptor from a Spring resource location.
 * <p>
 * Locations ending in {@code .yaml} or {@code .yml} are parsed as YAML, anything else as JSON.
 * Parsing uses the swagger-core object mappers, so the result is the same model that
 * {@code swagger-parser} or springdoc would produce.
 * </p>
 *
 * @author cyfko
 * @since 1.0
 */
public class OpenApiDescriptorLoader {

    private static final Logger logger = Logger.getLogger(OpenApiDescriptorLoader.class.getName());

    private final ResourceLoader resourceLoader;
    private final String location;

    public OpenApiDescriptorLoader(ResourceLoader resourceLoader, String location) {
        this.resourceLoader = Objects.requireNonNull(resourceLoader, "resourceLoader");
        this.location = Objects.requireNonNull(location, "location");
    }

    /**
     * Loads and parses the descriptor.
     *
     * @return the parsed descriptor
     * @throws DescriptorLoadException when the resource is missing, unreadable or malformed
     */
    public OpenAPI load() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            logger.severe(() -> "OpenAPI descriptor not found at " + location);
            throw new DescriptorLoadException(location, "OpenAPI descriptor not found at " + location);
        }

        try (InputStream in = resource.getInputStream()) {
            OpenAPI descriptor = mapperFor(location).readValue(in, OpenAPI.class);
            if (descriptor == null) {
                throw new DescriptorLoadException(location, "OpenAPI descriptor at " + location + " is empty");
            }
            logger.fine(() -> "Loaded OpenAPI descriptor from " + location);
            return descriptor;
        } catch (IOException e) {
            logger.log(Level.SEVERE, e, () -> "Cannot read OpenAPI descriptor at " + location);
            throw new DescriptorLoadException(location, "Cannot read OpenAPI descriptor at " + location, e);
        }
    }

    public String getLocation() {
        return location;
    }

    static ObjectMapper mapperFor(String location) {
        String lower = location.toLowerCase(Locale.ROOT);
        return lower.endsWith(".yaml") || lower.endsWith(".yml") ? Yaml.mapper() : Json.mapper();
    }
}
