package io.github.cyfko.hypermedia.core.utils;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Value helpers shared by the catalog and the resolver.
 *
 * @author cyfko
 * @since 1.0
 */
public final class Values {

    private Values() {
        // utility
    }

    /**
     * Tells whether a value counts as "supplied" when used as a template default.
     * <p>
     * {@code null}, {@code false}, numeric zero, empty strings, empty collections, empty maps,
     * empty arrays and empty {@link Optional}s are falsy; everything else is truthy.
     * </p>
     *
     * @param value any value
     * @return {@code true} when the value is truthy
     */
    public static boolean isTruthy(Object value) {
        if (value == null) return false;
        if (value instanceof Boolean b) return b;
        if (value instanceof BigDecimal d) return d.signum() != 0;
        if (value instanceof BigInteger i) return i.signum() != 0;
        if (value instanceof Double d) return d != 0.0d && !d.isNaN();
        if (value instanceof Float f) return f != 0.0f && !f.isNaN();
        if (value instanceof Number n) return n.longValue() != 0L;
        if (value instanceof Character) return true;
        if (value instanceof CharSequence s) return s.length() > 0;
        if (value instanceof Collection<?> c) return !c.isEmpty();
        if (value instanceof Map<?, ?> m) return !m.isEmpty();
        if (value instanceof Optional<?> o) return o.isPresent();
        if (value.getClass().isArray()) return Array.getLength(value) > 0;
        return true;
    }

    /**
     * Normalizes enum constants to their name; other values are returned unchanged.
     */
    public static Object scalar(Object value) {
        if (value instanceof Enum<?> e) {
            return e.name();
        }
        return value;
    }

    /**
     * Returns an unmodifiable deep copy of structured values (maps and collections).
     * Scalars are returned unchanged.
     */
    public static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, freeze(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
