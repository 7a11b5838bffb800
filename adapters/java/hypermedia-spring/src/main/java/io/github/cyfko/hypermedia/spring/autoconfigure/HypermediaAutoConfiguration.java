package io.github.cyfko.hypermedia.spring.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.cyfko.hypermedia.core.Hypermedia;
import io.github.cyfko.hypermedia.core.catalog.TransitionRegistry;
import io.github.cyfko.hypermedia.core.config.HypermediaConfig;
import io.github.cyfko.hypermedia.core.json.CollectionJsonWriter;
import io.github.cyfko.hypermedia.core.projection.RecordProjector;
import io.github.cyfko.hypermedia.core.representation.MarkupRenderer;
import io.github.cyfko.hypermedia.core.representation.Representor;
import io.github.cyfko.hypermedia.core.resolution.TransitionResolver;
import io.github.cyfko.hypermedia.core.spi.RequestContext;
import io.github.cyfko.hypermedia.spring.support.HandlerMethodIdentities;
import io.github.cyfko.hypermedia.spring.support.OpenApiDescriptorLoader;
import io.github.cyfko.hypermedia.spring.web.CollectionJsonHttpMessageConverter;
import io.github.cyfko.hypermedia.spring.web.ServletRequestContext;
import io.github.cyfko.hypermedia.spring.web.SpringRepresentor;
import io.swagger.v3.oas.models.OpenAPI;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ResourceLoader;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.util.stream.Collectors;

/**
 * Wires the hypermedia layer into a servlet web application.
 *
 * <h2>Descriptor Source</h2>
 * <p>
 * An {@link OpenAPI} bean supplied by the application is used as is. Otherwise the descriptor is
 * read from {@code hypermedia.openapi-location} the first time the catalog is needed.
 * </p>
 *
 * <h2>Overridable Beans</h2>
 * <p>
 * Every bean backs off when the application defines its own. A {@link MarkupRenderer} bean, when
 * present, is used for clients that do not ask for the hypermedia media type.
 * </p>
 *
 * @author cyfko
 * @since 1.0
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass({RequestMappingHandlerMapping.class, OpenAPI.class})
@ConditionalOnProperty(prefix = "hypermedia", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(HypermediaProperties.class)
public class HypermediaAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public HypermediaConfig hypermediaConfig(HypermediaProperties properties) {
        return properties.toConfig();
    }

    @Bean
    @ConditionalOnMissingBean
    public OpenApiDescriptorLoader openApiDescriptorLoader(ResourceLoader resourceLoader, HypermediaProperties properties) {
        return new OpenApiDescriptorLoader(resourceLoader, properties.getOpenapiLocation());
    }

    @Bean
    @ConditionalOnMissingBean
    public HandlerMethodIdentities handlerMethodIdentities(ObjectProvider<RequestMappingHandlerMapping> mappings) {
        return new HandlerMethodIdentities(() -> mappings.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public TransitionRegistry transitionRegistry(ObjectProvider<OpenAPI> descriptor,
                                                 OpenApiDescriptorLoader loader,
                                                 HandlerMethodIdentities identities,
                                                 HypermediaConfig config) {
        return new TransitionRegistry(() -> descriptor.getIfAvailable(loader::load), identities, config);
    }

    @Bean
    @ConditionalOnMissingBean
    public TransitionResolver transitionResolver(TransitionRegistry registry) {
        return new TransitionResolver(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordProjector recordProjector(HypermediaConfig config) {
        return new RecordProjector(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestContext requestContext() {
        return new ServletRequestContext();
    }

    @Bean
    @ConditionalOnMissingBean
    public Hypermedia hypermedia(TransitionResolver resolver, RecordProjector projector, RequestContext requestContext) {
        return new Hypermedia(resolver, projector, requestContext);
    }

    @Bean
    @ConditionalOnMissingBean
    public Representor representor(HypermediaConfig config, ObjectProvider<MarkupRenderer> renderer) {
        return new Representor(config, renderer.getIfAvailable());
    }

    @Bean
    @ConditionalOnMissingBean
    public SpringRepresentor springRepresentor(Representor representor, RequestContext requestContext) {
        return new SpringRepresentor(representor, requestContext);
    }

    @Bean
    @ConditionalOnMissingBean
    public CollectionJsonHttpMessageConverter collectionJsonHttpMessageConverter(ObjectProvider<ObjectMapper> objectMapper,
                                                                                 HypermediaConfig config) {
        ObjectMapper mapper = objectMapper.getIfAvailable(ObjectMapper::new).copy();
        return new CollectionJsonHttpMessageConverter(CollectionJsonWriter.configure(mapper), config.getMediaType());
    }
}
