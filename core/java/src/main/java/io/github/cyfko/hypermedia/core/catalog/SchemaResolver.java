package io.github.cyfko.hypermedia.core.catalog;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;

import java.util.List;
import java.util.Map;

/**
 * Follows local {@code $ref} pointers into the {@code components} section of a descriptor.
 * <p>
 * Only one level is followed per call. Pointers that cannot be resolved (external documents,
 * unknown names) resolve to {@code null}.
 * </p>
 */
final class SchemaResolver {

    private final Components components;

    SchemaResolver(OpenAPI descriptor) {
        this.components = descriptor.getComponents() == null ? new Components() : descriptor.getComponents();
    }

    /**
     * Returns the schema itself, or the schema its {@code $ref} points to.
     */
    Schema<?> resolve(Schema<?> schema) {
        if (schema == null || schema.get$ref() == null) {
            return schema;
        }
        return lookup(components.getSchemas(), schema.get$ref());
    }

    /**
     * Returns the schema a property refers to when it is declared as a reference to another
     * schema, either directly ({@code $ref}) or wrapped in a single-element {@code allOf}.
     *
     * @return the referenced schema, or {@code null} when the property is not a reference
     */
    Schema<?> referencedBy(Schema<?> property) {
        if (property.get$ref() != null) {
            return resolve(property);
        }
        List<Schema> allOf = property.getAllOf();
        if (allOf != null && !allOf.isEmpty() && allOf.get(0) != null && allOf.get(0).get$ref() != null) {
            return resolve(allOf.get(0));
        }
        return null;
    }

    Parameter resolve(Parameter parameter) {
        if (parameter == null || parameter.get$ref() == null) {
            return parameter;
        }
        return lookup(components.getParameters(), parameter.get$ref());
    }

    RequestBody resolve(RequestBody body) {
        if (body == null || body.get$ref() == null) {
            return body;
        }
        return lookup(components.getRequestBodies(), body.get$ref());
    }

    static String refName(String ref) {
        return ref.substring(ref.lastIndexOf('/') + 1);
    }

    private static <T> T lookup(Map<String, T> table, String ref) {
        if (table == null || (ref.contains("#") && !ref.startsWith("#"))) {
            return null;
        }
        return table.get(refName(ref));
    }
}
