package io.github.cyfko.hypermedia.core.catalog;

import io.github.cyfko.hypermedia.core.config.HypermediaConfig;
import io.swagger.v3.oas.models.OpenAPI;

import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Per-application cache of the {@link TransitionCatalog}.
 * <p>
 * The catalog is built lazily on the first call to {@link #catalog()} from the descriptor and
 * handler-identity sources, then reused for the lifetime of this registry. Each registry owns its
 * own catalog: two registries never share one, so independent application instances (and tests)
 * stay isolated.
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Get-or-build is not locked. Concurrent first callers may each build a catalog; since building is
 * a pure function of the descriptor the results are equal and the last one published wins. The
 * published catalog is immutable, so readers need no further synchronization.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * TransitionRegistry registry = new TransitionRegistry(() -> openApi, Map::of);
 * TransitionResolver resolver = new TransitionResolver(registry);
 * }</pre>
 *
 * @author cyfko
 * @since 1.0
 */
public class TransitionRegistry {

    private final Supplier<OpenAPI> descriptorSource;
    private final Supplier<? extends Map<?, String>> handleSource;
    private final CatalogBuilder builder;

    private volatile TransitionCatalog catalog;

    /**
     * @param descriptorSource supplies the API descriptor when the catalog is first needed
     * @param handleSource     supplies the handler-identity to operation-name mapping
     */
    public TransitionRegistry(Supplier<OpenAPI> descriptorSource, Supplier<? extends Map<?, String>> handleSource) {
        this(descriptorSource, handleSource, HypermediaConfig.defaults());
    }

    public TransitionRegistry(Supplier<OpenAPI> descriptorSource,
                              Supplier<? extends Map<?, String>> handleSource,
                              HypermediaConfig config) {
        this.descriptorSource = Objects.requireNonNull(descriptorSource, "descriptorSource");
        this.handleSource = Objects.requireNonNull(handleSource, "handleSource");
        this.builder = new CatalogBuilder(config);
    }

    /**
     * Convenience factory for a fixed descriptor without handler identities.
     */
    public static TransitionRegistry of(OpenAPI descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        return new TransitionRegistry(() -> descriptor, Map::of);
    }

    /**
     * Returns the catalog, building it if this registry has none yet.
     */
    public TransitionCatalog catalog() {
        TransitionCatalog current = catalog;
        if (current == null) {
            current = new TransitionCatalog(builder.build(descriptorSource.get()), handleSource.get());
            catalog = current;
        }
        return current;
    }

    public boolean isBuilt() {
        return catalog != null;
    }

    /**
     * Drops the cached catalog; the next {@link #catalog()} call rebuilds it.
     */
    public void invalidate() {
        catalog = null;
    }
}
