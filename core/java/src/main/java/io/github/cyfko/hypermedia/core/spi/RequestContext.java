package io.github.cyfko.hypermedia.core.spi;

/**
 * Access to the request currently being handled.
 * <p>
 * Web adapters implement this on top of their request abstraction; the Spring adapter reads the
 * thread-bound servlet request.
 * </p>
 *
 * @author cyfko
 * @since 1.0
 */
public interface RequestContext {

    /**
     * Full URL of the current request, used as the default document {@code href}.
     */
    String currentUrl();

    /**
     * Raw value of the {@code Accept} header, or {@code null} when absent.
     */
    String acceptHeader();

    /**
     * Fixed context, mostly useful outside a web container and in tests.
     */
    static RequestContext of(String currentUrl, String acceptHeader) {
        return new RequestContext() {
            @Override
            public String currentUrl() {
                return currentUrl;
            }

            @Override
            public String acceptHeader() {
                return acceptHeader;
            }
        };
    }
}
