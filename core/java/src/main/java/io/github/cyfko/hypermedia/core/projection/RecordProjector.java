package io.github.cyfko.hypermedia.core.projection;

import io.github.cyfko.hypermedia.core.config.HypermediaConfig;
import io.github.cyfko.hypermedia.core.model.FieldDescriptor;
import io.github.cyfko.hypermedia.core.model.Item;
import io.github.cyfko.hypermedia.core.model.Link;

import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Converts domain values into {@link Item}s using their declared shape.
 *
 * <h2>Declared Shape</h2>
 * <ul>
 *   <li><strong>Records:</strong> the record components, in declaration order</li>
 *   <li><strong>Other classes:</strong> the declared non-static, non-synthetic fields of the class
 *       and its superclasses (superclass fields first), read through a public getter when one exists</li>
 * </ul>
 * <p>
 * Each declared field yields one {@link FieldDescriptor}. The prompt is the {@link DisplayedAs}
 * title when present, otherwise the humanized field name. The type tag comes from
 * {@link JsonTypes}. Projection is a pure function of the value: the same state always yields the
 * same field list, whose size and order equal the declared shape.
 * </p>
 *
 * <pre>{@code
 * record Task(long id, String name, boolean active) { }
 *
 * Item item = projector.project(new Task(1, "Write docs", true), "/tasks/1", List.of());
 * // data: [id=1, name="Write docs", active=true]
 * }</pre>
 *
 * @author cyfko
 * @since 1.0
 */
public class RecordProjector {

    private final Map<Class<?>, List<Shape>> shapes = new ConcurrentHashMap<>();
    private final String defaultRel;

    public RecordProjector() {
        this(HypermediaConfig.defaults());
    }

    public RecordProjector(HypermediaConfig config) {
        this.defaultRel = Objects.requireNonNull(config, "config").getItemRelation();
    }

    public Item project(Object record, String href, List<Link> links) {
        return project(record, href, links, defaultRel);
    }

    /**
     * Projects a value into an item.
     *
     * @param record the domain value
     * @param href   URI of the item ({@code null} is treated as empty)
     * @param links  links attached to the item ({@code null} is treated as none)
     * @param rel    relation of the item ({@code null} means the configured default)
     * @return the item
     */
    public Item project(Object record, String href, List<Link> links, String rel) {
        return new Item(href, rel == null ? defaultRel : rel, data(record), links);
    }

    /**
     * Projects a value into its ordered data fields.
     */
    public List<FieldDescriptor> data(Object record) {
        Objects.requireNonNull(record, "record");
        List<Shape> shape = shapes.computeIfAbsent(record.getClass(), RecordProjector::shapeOf);
        List<FieldDescriptor> data = new ArrayList<>(shape.size());
        for (Shape field : shape) {
            data.add(FieldDescriptor.item(field.name(), field.read(record), field.prompt(), field.type(), field.renderHint()));
        }
        return data;
    }

    /**
     * Turns a field name into a label: underscores become spaces, camelCase boundaries are split
     * and each word is capitalized ({@code due_date} and {@code dueDate} both give {@code Due Date}).
     */
    public static String humanize(String name) {
        String spaced = name.replace('_', ' ').replaceAll("(?<=[a-z0-9])(?=[A-Z])", " ").trim();
        StringBuilder label = new StringBuilder(spaced.length());
        boolean wordStart = true;
        for (char c : spaced.toCharArray()) {
            label.append(wordStart ? Character.toUpperCase(c) : c);
            wordStart = c == ' ';
        }
        return label.toString();
    }

    private static List<Shape> shapeOf(Class<?> type) {
        List<Shape> shape = new ArrayList<>();
        if (type.isRecord()) {
            for (RecordComponent component : type.getRecordComponents()) {
                Method accessor = component.getAccessor();
                accessor.setAccessible(true);
                shape.add(Shape.of(component.getName(), component.getType(),
                        component.getAnnotation(DisplayedAs.class), accessor, null));
            }
            return List.copyOf(shape);
        }

        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
            hierarchy.add(0, current);
        }
        for (Class<?> declaring : hierarchy) {
            for (Field field : declaring.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || field.isSynthetic()) continue;
                Method getter = findGetter(type, field);
                if (getter != null) {
                    getter.setAccessible(true);
                } else {
                    field.setAccessible(true);
                }
                shape.add(Shape.of(field.getName(), field.getType(), field.getAnnotation(DisplayedAs.class), getter, field));
            }
        }
        return List.copyOf(shape);
    }

    private static Method findGetter(Class<?> type, Field field) {
        String suffix = Character.toUpperCase(field.getName().charAt(0)) + field.getName().substring(1);
        List<String> candidates = field.getType() == boolean.class
                ? List.of("is" + suffix, "get" + suffix)
                : List.of("get" + suffix);
        for (String candidate : candidates) {
            try {
                Method method = type.getMethod(candidate);
                if (method.getReturnType() == field.getType()) {
                    return method;
                }
            } catch (NoSuchMethodException ignored) {
                // no getter under this name, try the next candidate
            }
        }
        return null;
    }

    private record Shape(String name, String prompt, String type, String renderHint, Method getter, Field field) {

        static Shape of(String name, Class<?> javaType, DisplayedAs displayedAs, Method getter, Field field) {
            String title = displayedAs == null || displayedAs.value().isEmpty() ? humanize(name) : displayedAs.value();
            String hint = displayedAs == null || displayedAs.renderHint().isEmpty() ? null : displayedAs.renderHint();
            return new Shape(name, title, JsonTypes.of(javaType), hint, getter, field);
        }

        Object read(Object target) {
            try {
                return getter != null ? getter.invoke(target) : field.get(target);
            } catch (IllegalAccessException e) {
                throw new IllegalStateException("Cannot read field '" + name + "' of " + target.getClass().getName(), e);
            } catch (InvocationTargetException e) {
                throw new IllegalStateException("Accessor of field '" + name + "' failed on "
                        + target.getClass().getName(), e.getCause());
            }
        }
    }
}
