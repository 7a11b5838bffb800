package io.github.cyfko.hypermedia.core.catalog;

import io.github.cyfko.hypermedia.core.SampleApi;
import io.github.cyfko.hypermedia.core.config.HypermediaConfig;
import io.github.cyfko.hypermedia.core.model.FieldDescriptor;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.Operation;
import io.swagger.v3.oas.models.PathItem;
import io.swagger.v3.oas.models.Paths;
import io.swagger.v3.oas.models.media.Schema;
import io.swagger.v3.oas.models.media.StringSchema;
import io.swagger.v3.oas.models.parameters.QueryParameter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CatalogBuilder")
class CatalogBuilderTest {

    private Map<String, Transition> catalog;

    @BeforeEach
    void setUp() {
        catalog = new CatalogBuilder().build(SampleApi.descriptor());
    }

    private static List<String> names(Transition transition) {
        return transition.fields().stream().map(FieldDescriptor::name).toList();
    }

    private static FieldDescriptor field(Transition transition, String name) {
        return transition.fields().stream()
                .filter(f -> f.name().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No field " + name + " in " + transition.name()));
    }

    @Test
    @DisplayName("Only named operations become transitions")
    void onlyNamedOperationsAreCatalogued() {
        assertEquals(Set.of("list_items", "create_item", "view_item", "update_item", "view_note",
                        "search_items", "bulk_import", "login", "home"),
                catalog.keySet(), "The unnamed DELETE operation must be excluded");
    }

    @Test
    @DisplayName("Transition carries path template, method, joined tags and summary")
    void transitionMetadata() {
        Transition create = catalog.get("create_item");

        assertEquals("/items", create.href());
        assertEquals("POST", create.method());
        assertEquals("items create", create.rel(), "Tags are joined with a single space");
        assertEquals("Create Item", create.title());

        Transition view = catalog.get("view_item");
        assertEquals("/items/{item_id}", view.href(), "Templates are kept unexpanded");
        assertEquals("GET", view.method());
    }

    @Test
    @DisplayName("Untagged operation without summary gets empty rel and title")
    void untaggedOperation() {
        Transition search = catalog.get("search_items");

        assertEquals("", search.rel());
        assertEquals("", search.title());
    }

    @Test
    @DisplayName("Catalog is unmodifiable")
    void catalogIsUnmodifiable() {
        assertThrows(UnsupportedOperationException.class, () -> catalog.remove("home"));
        assertThrows(UnsupportedOperationException.class,
                () -> catalog.get("list_items").fields().clear());
    }

    @Test
    @DisplayName("Building twice from the same descriptor yields equal catalogs")
    void buildIsDeterministic() {
        Map<String, Transition> again = new CatalogBuilder().build(SampleApi.descriptor());

        assertEquals(catalog, again);
    }

    @Test
    @DisplayName("Empty descriptor yields empty catalog")
    void emptyDescriptor() {
        assertTrue(new CatalogBuilder().build(new OpenAPI()).isEmpty());
    }

    @Nested
    @DisplayName("Query parameters")
    class QueryParameters {

        @Test
        @DisplayName("Query parameters become fields with schema type, description prompt and default value")
        void queryFields() {
            Transition list = catalog.get("list_items");

            assertEquals(List.of("q", "limit"), names(list));

            FieldDescriptor q = field(list, "q");
            assertEquals("string", q.type());
            assertEquals("string", q.inputType());
            assertEquals("Search text", q.prompt());
            assertNull(q.value());
            assertEquals(Boolean.FALSE, q.required());

            FieldDescriptor limit = field(list, "limit");
            assertEquals("integer", limit.type());
            assertEquals("integer", limit.inputType(), "Query input type mirrors the declared type");
            assertEquals("limit", limit.prompt(), "Prompt falls back to the parameter name");
            assertEquals(10, limit.value());
            assertEquals(Boolean.TRUE, limit.required());
        }

        @Test
        @DisplayName("Path parameters are not fields")
        void pathParametersExcluded() {
            assertTrue(catalog.get("view_item").fields().isEmpty());
            assertEquals(List.of("name", "done"), names(catalog.get("update_item")));
        }

        @Test
        @DisplayName("Referenced parameters are resolved from components")
        void referencedParameter() {
            FieldDescriptor pageSize = field(catalog.get("search_items"), "page_size");

            assertEquals("Results per page", pageSize.prompt());
            assertEquals("integer", pageSize.type());
            assertEquals(20, pageSize.value());
        }

        @Test
        @DisplayName("Operation-level parameter overrides a path-level one with the same name")
        void operationParameterOverridesPathParameter() {
            // Given
            PathItem item = new PathItem()
                    .addParametersItem(new QueryParameter().name("sort").description("Path level").schema(new StringSchema()))
                    .get(new Operation().operationId("sorted")
                            .addParametersItem(new QueryParameter().name("sort").description("Operation level")
                                    .schema(new StringSchema())));
            OpenAPI api = new OpenAPI().paths(new Paths().addPathItem("/sorted", item));

            // When
            Transition sorted = new CatalogBuilder().build(api).get("sorted");

            // Then
            assertEquals(1, sorted.fields().size());
            assertEquals("Operation level", sorted.fields().get(0).prompt());
        }
    }

    @Nested
    @DisplayName("Request bodies")
    class RequestBodies {

        @Test
        @DisplayName("Referenced object schema yields one field per property in declaration order")
        void referencedObjectSchema() {
            Transition create = catalog.get("create_item");

            assertEquals(List.of("name", "description", "priority", "done", "estimate", "status"), names(create));

            FieldDescriptor name = field(create, "name");
            assertEquals("Name", name.prompt());
            assertEquals("text", name.inputType());
            assertEquals(Boolean.TRUE, name.required());

            FieldDescriptor estimate = field(create, "estimate");
            assertEquals("number", estimate.inputType());
            assertEquals(Boolean.FALSE, estimate.required());
        }

        @Test
        @DisplayName("Prompt falls back to the property name when no title is declared")
        void promptFallsBackToName() {
            assertEquals("status", field(catalog.get("create_item"), "status").prompt());
        }

        @Test
        @DisplayName("Enumeration through allOf reference becomes a select with options")
        void enumThroughAllOf() {
            FieldDescriptor priority = field(catalog.get("create_item"), "priority");

            assertEquals("string", priority.type());
            assertEquals("select", priority.inputType());
            assertEquals(List.of("low", "medium", "high"), priority.options());
            assertEquals("medium", priority.value());
        }

        @Test
        @DisplayName("Enumeration through a direct reference becomes a select with options")
        void enumThroughDirectRef() {
            FieldDescriptor status = field(catalog.get("create_item"), "status");

            assertEquals("select", status.inputType());
            assertEquals(List.of("open", "closed"), status.options());
        }

        @Test
        @DisplayName("Boolean property becomes a checkbox keeping its false default")
        void booleanProperty() {
            FieldDescriptor done = field(catalog.get("create_item"), "done");

            assertEquals("boolean", done.type());
            assertEquals("checkbox", done.inputType());
            assertEquals(Boolean.FALSE, done.value());
        }

        @Test
        @DisplayName("Render hint extension is copied onto the field")
        void renderHint() {
            assertEquals("textarea", field(catalog.get("create_item"), "description").renderHint());
            assertNull(field(catalog.get("create_item"), "name").renderHint());
        }

        @Test
        @DisplayName("Form-encoded body is used when no JSON body is declared")
        void formEncodedBody() {
            Transition login = catalog.get("login");

            assertEquals(List.of("username", "password"), names(login));
            assertEquals("password", field(login, "password").renderHint());
            assertEquals(Boolean.TRUE, field(login, "username").required());
        }

        @Test
        @DisplayName("Inline object schema is read directly")
        void inlineSchema() {
            Transition update = catalog.get("update_item");

            assertEquals("PUT", update.method());
            assertEquals(Boolean.TRUE, field(update, "done").required());
            assertEquals(Boolean.FALSE, field(update, "name").required());
        }

        @Test
        @DisplayName("Body schema without properties contributes no fields")
        void unsupportedShape() {
            assertTrue(catalog.get("bulk_import").fields().isEmpty());
        }

        @Test
        @DisplayName("Body with an unsupported media type contributes no fields")
        void unsupportedMediaType() {
            // Given
            HypermediaConfig jsonOnly = HypermediaConfig.builder()
                    .bodyMediaTypes(List.of("application/json"))
                    .build();

            // When
            Map<String, Transition> restricted = new CatalogBuilder(jsonOnly).build(SampleApi.descriptor());

            // Then
            assertTrue(restricted.get("login").fields().isEmpty());
            assertFalse(restricted.get("create_item").fields().isEmpty());
        }

        @Test
        @DisplayName("Render hint extension name is configurable")
        void customRenderHintExtension() {
            // Given
            Schema<?> notes = new StringSchema();
            notes.addExtension("x-widget", "richtext");
            Schema<?> body = new io.swagger.v3.oas.models.media.ObjectSchema();
            body.setProperties(new java.util.LinkedHashMap<>(Map.of("notes", notes)));
            OpenAPI api = new OpenAPI().paths(new Paths().addPathItem("/notes", new PathItem()
                    .post(new Operation().operationId("add_note").requestBody(jsonBody(body)))));
            HypermediaConfig config = HypermediaConfig.builder().renderHintExtension("x-widget").build();

            // When
            Transition addNote = new CatalogBuilder(config).build(api).get("add_note");

            // Then
            assertEquals("richtext", addNote.fields().get(0).renderHint());
        }

        private io.swagger.v3.oas.models.parameters.RequestBody jsonBody(Schema<?> schema) {
            return new io.swagger.v3.oas.models.parameters.RequestBody().content(
                    new io.swagger.v3.oas.models.media.Content().addMediaType("application/json",
                            new io.swagger.v3.oas.models.media.MediaType().schema(schema)));
        }
    }

    @Nested
    @DisplayName("Type detection")
    class TypeDetection {

        @Test
        @DisplayName("Multi-type schema uses the first non-null type")
        void multiTypeSchema() {
            Schema<Object> schema = new Schema<>();
            schema.setTypes(new java.util.LinkedHashSet<>(List.of("null", "integer")));

            assertEquals("integer", CatalogBuilder.typeOf(schema, "string"));
        }

        @Test
        @DisplayName("Untyped schema uses the fallback")
        void untypedSchema() {
            assertEquals("string", CatalogBuilder.typeOf(new Schema<>(), "string"));
        }
    }
}
