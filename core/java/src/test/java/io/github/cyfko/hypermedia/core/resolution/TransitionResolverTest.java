package io.github.cyfko.hypermedia.core.resolution;

import io.github.cyfko.hypermedia.core.SampleApi;
import io.github.cyfko.hypermedia.core.catalog.TransitionRegistry;
import io.github.cyfko.hypermedia.core.exception.MissingParameterException;
import io.github.cyfko.hypermedia.core.model.FieldDescriptor;
import io.github.cyfko.hypermedia.core.model.Link;
import io.github.cyfko.hypermedia.core.model.Query;
import io.github.cyfko.hypermedia.core.model.Template;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TransitionResolver")
class TransitionResolverTest {

    enum Priority { LOW, HIGH }

    private TransitionResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new TransitionResolver(TransitionRegistry.of(SampleApi.descriptor()));
    }

    private ResolvedTransition resolve(String name, Map<String, ?> context) {
        return resolver.resolve(name, context).orElseThrow();
    }

    private static FieldDescriptor field(Template template, String name) {
        return template.data().stream().filter(f -> f.name().equals(name)).findFirst().orElseThrow();
    }

    @Nested
    @DisplayName("Path substitution")
    class PathSubstitution {

        @Test
        @DisplayName("Placeholder is replaced by the context value")
        void substitutesPlaceholder() {
            assertEquals("/items/42", resolve("view_item", Map.of("item_id", "42")).href());
        }

        @Test
        @DisplayName("Non-string values use their string form")
        void nonStringValues() {
            assertEquals("/items/7/notes/3", resolve("view_note", Map.of("item_id", 7, "note_id", 3L)).href());
        }

        @Test
        @DisplayName("Missing placeholder value raises an error naming the placeholder")
        void missingPlaceholder() {
            MissingParameterException ex = assertThrows(MissingParameterException.class,
                    () -> resolver.resolve("view_item", Map.of()));

            assertEquals("item_id", ex.parameterName());
            assertEquals("view_item", ex.transitionName());
            assertEquals("/items/{item_id}", ex.hrefTemplate());
            assertTrue(ex.getMessage().contains("item_id"));
        }

        @Test
        @DisplayName("Second placeholder missing is reported")
        void secondPlaceholderMissing() {
            MissingParameterException ex = assertThrows(MissingParameterException.class,
                    () -> resolver.resolve("view_note", Map.of("item_id", 1)));

            assertEquals("note_id", ex.parameterName());
        }

        @Test
        @DisplayName("Extra context entries are ignored")
        void extraContextIgnored() {
            assertEquals("/items/42", resolve("view_item", Map.of("item_id", 42, "unused", "x")).href());
        }

        @Test
        @DisplayName("Template without placeholders is unchanged for any context")
        void noPlaceholders() {
            assertEquals("/items", resolve("list_items", Map.of()).href());
            assertEquals("/items", resolve("list_items", Map.of("item_id", 1)).href());
            assertEquals("/", resolve("home", null).href());
        }

        @Test
        @DisplayName("Resolution leaves the catalog untouched")
        void catalogUntouched() {
            resolve("view_item", Map.of("item_id", 1));
            resolve("view_item", Map.of("item_id", 2));

            assertEquals("/items/{item_id}",
                    resolver.registry().catalog().find("view_item").orElseThrow().href());
        }
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("Unknown name resolves to empty")
        void unknownName() {
            assertEquals(Optional.empty(), resolver.resolve("does_not_exist", Map.of()));
        }

        @Test
        @DisplayName("Handler identity resolves through the catalog mapping")
        void handleLookup() {
            // Given
            Object handler = new Object();
            TransitionResolver byHandle = new TransitionResolver(new TransitionRegistry(
                    SampleApi::descriptor, () -> Map.of(handler, "view_item")));

            // When
            Optional<ResolvedTransition> resolved = byHandle.resolveHandle(handler, Map.of("item_id", 5));

            // Then
            assertEquals("/items/5", resolved.orElseThrow().href());
            assertTrue(byHandle.resolveHandle(new Object(), Map.of()).isEmpty());
        }

        @Test
        @DisplayName("String handle is treated as a name")
        void stringHandle() {
            assertEquals("/items", resolver.resolveHandle("list_items", Map.of()).orElseThrow().href());
        }
    }

    @Nested
    @DisplayName("Conversions")
    class Conversions {

        @Test
        @DisplayName("Link carries the default relation, title as prompt and method")
        void toLink() {
            Link link = resolve("view_item", Map.of("item_id", 1)).toLink();

            assertEquals("item", link.rel());
            assertEquals("/items/1", link.href());
            assertEquals("View Item", link.prompt());
            assertEquals("GET", link.method());
        }

        @Test
        @DisplayName("Relation override replaces the default unless empty")
        void linkRelationOverride() {
            ResolvedTransition view = resolve("view_item", Map.of("item_id", 1));

            assertEquals("self", view.toLink("self").rel());
            assertEquals("item", view.toLink("").rel());
            assertEquals("item", view.toLink(null).rel());
        }

        @Test
        @DisplayName("Query keeps the fields without required flags")
        void toQuery() {
            Query query = resolve("list_items", Map.of()).toQuery();

            assertEquals("items", query.rel());
            assertEquals("/items", query.href());
            assertEquals("List Items", query.prompt());
            assertEquals(List.of("q", "limit"), query.data().stream().map(FieldDescriptor::name).toList());
            assertTrue(query.data().stream().allMatch(f -> f.required() == null));
        }

        @Test
        @DisplayName("Template keeps schema values and required flags")
        void toTemplate() {
            Template template = resolve("create_item", Map.of()).toTemplate();

            assertEquals("create_item", template.name());
            assertEquals("POST", template.method());
            assertEquals("/items", template.href());
            assertEquals("items create", template.rel());
            assertEquals("medium", field(template, "priority").value());
            assertEquals(Boolean.TRUE, field(template, "name").required());
            assertEquals(Boolean.FALSE, field(template, "estimate").required());
        }

        @Test
        @DisplayName("Conversions are repeatable and do not affect each other")
        void conversionsAreRepeatable() {
            ResolvedTransition create = resolve("create_item", Map.of());

            Template first = create.toTemplate(Map.of("name", "Filled"));
            Template second = create.toTemplate();
            Query query = create.toQuery();

            assertEquals("Filled", field(first, "name").value());
            assertNull(field(second, "name").value(), "Earlier defaults must not leak");
            assertEquals(create.toTemplate(), second);
            assertEquals(create.toLink(), create.toLink());
            assertNull(query.data().get(0).value());
        }

        @Test
        @DisplayName("Truthy defaults override field values")
        void truthyDefaultsOverride() {
            Template template = resolve("create_item", Map.of()).toTemplate(
                    Map.of("name", "Task", "estimate", 3, "done", true));

            assertEquals("Task", field(template, "name").value());
            assertEquals(3, field(template, "estimate").value());
            assertEquals(Boolean.TRUE, field(template, "done").value());
        }

        @Test
        @DisplayName("Falsy defaults keep the schema value")
        void falsyDefaultsIgnored() {
            // Given
            Map<String, Object> defaults = new HashMap<>();
            defaults.put("priority", "");
            defaults.put("estimate", 0);
            defaults.put("done", false);
            defaults.put("name", null);

            // When
            Template template = resolve("create_item", Map.of()).toTemplate(defaults);

            // Then
            assertEquals("medium", field(template, "priority").value());
            assertNull(field(template, "estimate").value());
            assertEquals(Boolean.FALSE, field(template, "done").value());
            assertNull(field(template, "name").value());
        }

        @Test
        @DisplayName("Enum defaults are normalized to their name")
        void enumDefaults() {
            Template template = resolve("create_item", Map.of()).toTemplate(Map.of("priority", Priority.HIGH));

            assertEquals("HIGH", field(template, "priority").value());
        }
    }
}
