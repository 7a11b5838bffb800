package io.github.cyfko.hypermedia.spring.support;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.lang.reflect.Method;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Maps controller methods to the OpenAPI operation they implement.
 *
 * <h2>Naming Rules</h2>
 * <ul>
 *   <li>{@code @Operation(operationId = "...")} on the method wins</li>
 *   <li>Otherwise the Java method name is the operation name, the springdoc default</li>
 * </ul>
 * <p>
 * The mappings are read when {@link #get()} is called, so the registry can defer it until the
 * first request, once every handler mapping is initialized.
 * </p>
 *
 * @author cyfko
 * @since 1.0
 */
public class HandlerMethodIdentities implements Supplier<Map<Method, String>> {

    private static final Logger logger = Logger.getLogger(HandlerMethodIdentities.class.getName());

    private final Supplier<List<RequestMappingHandlerMapping>> mappings;

    public HandlerMethodIdentities(Supplier<List<RequestMappingHandlerMapping>> mappings) {
        this.mappings = Objects.requireNonNull(mappings, "mappings");
    }

    @Override
    public Map<Method, String> get() {
        Map<Method, String> identities = new LinkedHashMap<>();
        for (RequestMappingHandlerMapping mapping : mappings.get()) {
            for (HandlerMethod handlerMethod : mapping.getHandlerMethods().values()) {
                Method method = handlerMethod.getMethod();
                identities.putIfAbsent(method, operationName(method));
            }
        }
        logger.fine(() -> "Resolved " + identities.size() + " handler identities");
        return identities;
    }

    /**
     * Operation name implemented by a handler method.
     */
    public static String operationName(Method method) {
        Operation operation = AnnotatedElementUtils.findMergedAnnotation(method, Operation.class);
        if (operation != null && !operation.operationId().isBlank()) {
            return operation.operationId();
        }
        return method.getName();
    }

    /**
     * Looks up the handler method with the given name, for use as a transition handle.
     *
     * <pre>{@code
     * TransitionRef.handle(HandlerMethodIdentities.method(TaskController.class, "viewTask"))
     * }</pre>
     *
     * @throws IllegalArgumentException when the type declares no method with that name
     */
    public static Method method(Class<?> type, String name) {
        for (Method method : type.getDeclaredMethods()) {
            if (method.getName().equals(name) && !method.isSynthetic()) {
                return method;
            }
        }
        throw new IllegalArgumentException("No method '" + name + "' declared by " + type.getName());
    }
}
