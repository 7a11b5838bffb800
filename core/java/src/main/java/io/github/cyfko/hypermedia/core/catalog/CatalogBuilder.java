package io.github.cyfko.hypermedia.core.catalog;

import io.github.cyfko.hypermedia.core.config.HypermediaConfig;
import io.github.cyfko.hypermedia.core.model.FieldDescriptor;
import io.github.cyfko.hypermedia.core.utils.Values;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.media.Content;
import io.swagger.v3.oas.models.media.MediaType;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.parameters.Parameter;
import io.swagger.v3.oas.models.parameters.RequestBody;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Introspects an OpenAPI descriptor and produces the name-indexed table of {@link Transition}s.
 *
 * <h2>Extraction Rules</h2>
 * <ul>
 *   <li>Operations without an {@code operationId} are skipped.</li>
 *   <li>Query parameters become fields whose type and input type are the parameter's declared
 *       scalar type, whose value is the declared default and whose prompt is the description.</li>
 *   <li>Path parameters are read but never become fields.</li>
 *   <li>The request body (first configured media type present) is expanded property by property
 *       when its schema is an inline object or a single {@code $ref} to one. Enumerations are taken
 *       from the property itself or from the enum schema it references.</li>
 *   <li>Any other body shape yields no body fields. This is not an error.</li>
 * </ul>
 *
 * <p>
 * Building is a pure function of the descriptor: the same descriptor always produces an equal table.
 * </p>
 *
 * @author cyfko
 * @since 1.0
 */
public final class CatalogBuilder {

    private static final Logger logger = Logger.getLogger(CatalogBuilder.class.getName());

    private static final String DEFAULT_TYPE = "string";

    private final HypermediaConfig config;

    public CatalogBuilder() {
        this(HypermediaConfig.defaults());
    }

    public CatalogBuilder(HypermediaConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Builds the transition table.
     *
     * @param descriptor the API descriptor
     * @return unmodifiable map of transitions by operation name, in path declaration order
     */
    public Map<String, Transition> build(OpenAPI descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        long start = System.nanoTime();

        SchemaResolver resolver = new SchemaResolver(descriptor);
        Map<String, Transition> transitions = new LinkedHashMap<>();

        if (descriptor.getPaths() != null) {
            for (Map.Entry<String, PathItem> pathEntry : descriptor.getPaths().entrySet()) {
                PathItem pathItem = pathEntry.getValue();
                if (pathItem == null) continue;

                for (Map.Entry<PathItem.HttpMethod, Operation> operationEntry : pathItem.readOperationsMap().entrySet()) {
                    Operation operation = operationEntry.getValue();
                    String name = operation.getOperationId();
                    if (name == null || name.isBlank()) {
                        logger.fine(() -> "Skipping unnamed operation " + operationEntry.getKey() + " " + pathEntry.getKey());
                        continue;
                    }
                    transitions.put(name, toTransition(name, pathEntry.getKey(), operationEntry.getKey(),
                            pathItem, operation, resolver));
                }
            }
        }

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        logger.info(() -> String.format("Transition catalog built in %dms: %d transitions", durationMs, transitions.size()));
        return Collections.unmodifiableMap(transitions);
    }

    private Transition toTransition(String name, String path, PathItem.HttpMethod method,
                                    PathItem pathItem, Operation operation, SchemaResolver resolver) {
        List<FieldDescriptor> fields = new ArrayList<>();

        for (Parameter parameter : parameters(pathItem, operation, resolver)) {
            // path parameters are URL placeholders, not data
            if ("query".equals(parameter.getIn())) {
                fields.add(queryField(parameter));
            }
        }

        RequestBody body = resolver.resolve(operation.getRequestBody());
        if (body != null) {
            fields.addAll(bodyFields(name, body.getContent(), resolver));
        }

        String tags = operation.getTags() == null ? "" : String.join(" ", operation.getTags());
        String title = operation.getSummary() == null ? "" : operation.getSummary();
        return new Transition(name, path, tags, title, method.name(), fields);
    }

    /**
     * Path-level parameters first, overridden by operation-level parameters with the same name and location.
     */
    private static List<Parameter> parameters(PathItem pathItem, Operation operation, SchemaResolver resolver) {
        Map<String, Parameter> byKey = new LinkedHashMap<>();
        List<List<Parameter>> sources = new ArrayList<>(2);
        if (pathItem.getParameters() != null) sources.add(pathItem.getParameters());
        if (operation.getParameters() != null) sources.add(operation.getParameters());

        for (List<Parameter> source : sources) {
            for (Parameter raw : source) {
                Parameter parameter = resolver.resolve(raw);
                if (parameter == null || parameter.getName() == null) continue;
                byKey.put(parameter.getIn() + ":" + parameter.getName(), parameter);
            }
        }
        return new ArrayList<>(byKey.values());
    }

    private static FieldDescriptor queryField(Parameter parameter) {
        Schema<?> schema = parameter.getSchema();
        String type = schema == null ? DEFAULT_TYPE : typeOf(schema, DEFAULT_TYPE);
        Object value = schema == null ? null : Values.freeze(schema.getDefault());
        String prompt = parameter.getDescription() != null ? parameter.getDescription() : parameter.getName();
        return new FieldDescriptor(parameter.getName(), value, prompt, type, type, null, null,
                Boolean.TRUE.equals(parameter.getRequired()));
    }

    private List<FieldDescriptor> bodyFields(String name, Content content, SchemaResolver resolver) {
        if (content == null) {
            return List.of();
        }
        for (String mediaType : config.getBodyMediaTypes()) {
            if (content.containsKey(mediaType)) {
                MediaType media = content.get(mediaType);
                return schemaFields(name, media == null ? null : media.getSchema(), resolver);
            }
        }
        logger.fine(() -> "No supported body media type for transition '" + name + "': " + content.keySet());
        return List.of();
    }

    private List<FieldDescriptor> schemaFields(String name, Schema<?> bodySchema, SchemaResolver resolver) {
        if (bodySchema == null) {
            return List.of();
        }
        Schema<?> objectSchema = resolver.resolve(bodySchema);
        if (objectSchema == null || objectSchema.getProperties() == null || objectSchema.getProperties().isEmpty()) {
            logger.fine(() -> "Unsupported body schema shape for transition '" + name + "', no fields extracted");
            return List.of();
        }

        List<String> required = objectSchema.getRequired() == null ? List.of() : objectSchema.getRequired();
        List<FieldDescriptor> fields = new ArrayList<>(objectSchema.getProperties().size());
        for (Map.Entry<String, Schema> property : objectSchema.getProperties().entrySet()) {
            if (property.getValue() == null) continue;
            fields.add(propertyField(property.getKey(), property.getValue(), required.contains(property.getKey()), resolver));
        }
        return fields;
    }

    private FieldDescriptor propertyField(String name, Schema<?> property, boolean required, SchemaResolver resolver) {
        List<?> enumValues = property.getEnum();
        String type = typeOf(property, DEFAULT_TYPE);

        Schema<?> referenced = resolver.referencedBy(property);
        if (referenced != null) {
            enumValues = referenced.getEnum();
            type = typeOf(referenced, type);
        }

        List<String> options = null;
        if (enumValues != null && !enumValues.isEmpty()) {
            options = enumValues.stream().map(String::valueOf).toList();
        }

        String prompt = property.getTitle() != null ? property.getTitle() : name;
        return new FieldDescriptor(
                name,
                Values.freeze(property.getDefault()),
                prompt,
                type,
                InputTypes.forType(type, options != null),
                renderHint(property),
                options,
                required);
    }

    private String renderHint(Schema<?> property) {
        Map<String, Object> extensions = property.getExtensions();
        if (extensions == null) return null;
        Object hint = extensions.get(config.getRenderHintExtension());
        return hint == null ? null : String.valueOf(hint);
    }

    /**
     * Declared type of a schema: OpenAPI 3.0 {@code type}, else the first non-null OpenAPI 3.1 {@code types} entry.
     */
    static String typeOf(Schema<?> schema, String fallback) {
        if (schema.getType() != null) {
            return schema.getType();
        }
        Set<String> types = schema.getTypes();
        if (types != null) {
            for (String type : types) {
                if (!"null".equals(type)) return type;
            }
        }
        return fallback;
    }
}
