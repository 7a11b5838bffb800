package io.github.cyfko.hypermedia.core.projection;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.URI;
import java.net.URL;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.Date;
import java.util.Set;
import java.util.UUID;

/**
 * Maps Java types to JSON schema type tags.
 *
 * @author cyfko
 * @since 1.0
 */
public final class JsonTypes {

    public static final String BOOLEAN = "boolean";
    public static final String INTEGER = "integer";
    public static final String NUMBER = "number";
    public static final String STRING = "string";
    public static final String ARRAY = "array";
    public static final String OBJECT = "object";

    private static final Set<Class<?>> INTEGRAL = Set.of(
            byte.class, short.class, int.class, long.class,
            Byte.class, Short.class, Integer.class, Long.class, BigInteger.class);

    private static final Set<Class<?>> FLOATING = Set.of(
            float.class, double.class, Float.class, Double.class, BigDecimal.class);

    private JsonTypes() {
        // utility
    }

    public static String of(Class<?> type) {
        if (type == boolean.class || type == Boolean.class) return BOOLEAN;
        if (INTEGRAL.contains(type)) return INTEGER;
        if (FLOATING.contains(type)) return NUMBER;
        if (type == char.class || type == Character.class
                || CharSequence.class.isAssignableFrom(type)
                || type.isEnum()
                || type == UUID.class || type == URI.class || type == URL.class
                || TemporalAccessor.class.isAssignableFrom(type)
                || Date.class.isAssignableFrom(type)) {
            return STRING;
        }
        if (type.isArray() || Collection.class.isAssignableFrom(type)) return ARRAY;
        return OBJECT;
    }
}
