package io.github.cyfko.hypermedia.core.utils;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ValuesTest {

    enum Color { RED }

    @Test
    @DisplayName("Empty and zero values are falsy")
    void falsyValues() {
        for (Object value : new Object[]{null, false, 0, 0L, 0.0d, Double.NaN, BigDecimal.ZERO, "",
                List.of(), Map.of(), new int[0], Optional.empty()}) {
            assertFalse(Values.isTruthy(value), () -> "Expected falsy: " + value);
        }
    }

    @Test
    @DisplayName("Non-empty and non-zero values are truthy")
    void truthyValues() {
        for (Object value : new Object[]{true, 1, -1L, 0.5d, new BigDecimal("0.1"), "x", " ",
                List.of(0), Map.of("k", ""), new int[1], Optional.of(""), 'c', new Object(), Color.RED}) {
            assertTrue(Values.isTruthy(value), () -> "Expected truthy: " + value);
        }
    }

    @Test
    @DisplayName("Enum constants normalize to their name")
    void scalar() {
        assertEquals("RED", Values.scalar(Color.RED));
        assertEquals(5, Values.scalar(5));
        assertNull(Values.scalar(null));
    }

    @Test
    @DisplayName("Structured values are copied and made unmodifiable")
    @SuppressWarnings("unchecked")
    void freeze() {
        // Given
        List<Object> inner = new ArrayList<>(List.of("a"));
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("list", inner);

        // When
        Map<String, Object> frozen = (Map<String, Object>) Values.freeze(source);
        inner.add("b");

        // Then
        assertEquals(List.of("a"), frozen.get("list"), "Frozen copy must not see later changes");
        assertThrows(UnsupportedOperationException.class, () -> frozen.put("x", 1));
        assertThrows(UnsupportedOperationException.class, () -> ((List<Object>) frozen.get("list")).add("c"));
        assertEquals("scalar", Values.freeze("scalar"));
    }
}
