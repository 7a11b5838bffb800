package io.github.cyfko.hypermedia.spring.web;

import io.github.cyfko.hypermedia.core.spi.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;
import org.springframework.web.servlet.support.ServletUriComponentsBuilder;

/**
 * {@link RequestContext} backed by the servlet request bound to the current thread.
 * Outside a request both accessors return {@code null}.
 *
 * @author cyfko
 * @since 1.0
 */
public class ServletRequestContext implements RequestContext {

    @Override
    public String currentUrl() {
        if (currentRequest() == null) {
            return null;
        }
        return ServletUriComponentsBuilder.fromCurrentRequest().build().toUriString();
    }

    @Override
    public String acceptHeader() {
        HttpServletRequest request = currentRequest();
        return request == null ? null : request.getHeader(HttpHeaders.ACCEPT);
    }

    private static HttpServletRequest currentRequest() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes instanceof ServletRequestAttributes servletAttributes) {
            return servletAttributes.getRequest();
        }
        return null;
    }
}
