package io.github.cyfko.hypermedia.core.catalog;

/**
 * Maps declared schema types to suggested form input controls.
 *
 * <table>
 *   <caption>Mapping</caption>
 *   <tr><th>declared type</th><th>input type</th></tr>
 *   <tr><td>boolean</td><td>checkbox</td></tr>
 *   <tr><td>integer, number</td><td>number</td></tr>
 *   <tr><td>string with enumeration</td><td>select</td></tr>
 *   <tr><td>string</td><td>text</td></tr>
 *   <tr><td>anything else</td><td>the declared type itself</td></tr>
 * </table>
 *
 * @author cyfko
 * @since 1.0
 */
public final class InputTypes {

    public static final String CHECKBOX = "checkbox";
    public static final String NUMBER = "number";
    public static final String SELECT = "select";
    public static final String TEXT = "text";

    private InputTypes() {
        // utility
    }

    public static String forType(String declaredType, boolean enumerated) {
        return switch (declaredType) {
            case "boolean" -> CHECKBOX;
            case "integer", "number" -> NUMBER;
            case "string" -> enumerated ? SELECT : TEXT;
            default -> declaredType;
        };
    }
}
