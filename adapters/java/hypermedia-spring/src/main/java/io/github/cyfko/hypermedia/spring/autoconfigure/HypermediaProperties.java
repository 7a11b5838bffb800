package io.github.cyfko.hypermedia.spring.autoconfigure;

import io.github.cyfko.hypermedia.core.config.HypermediaConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings bound from {@code hypermedia.*}.
 *
 * <pre>
 * hypermedia:
 *   openapi-location: classpath:openapi.yaml
 *   item-relation: entry
 *   body-media-types: application/x-www-form-urlencoded, application/json
 * </pre>
 *
 * @author cyfko
 * @since 1.0
 */
@ConfigurationProperties(prefix = "hypermedia")
public class HypermediaProperties {

    private boolean enabled = true;
    private String openapiLocation = "classpath:openapi.json";
    private String mediaType = HypermediaConfig.COLLECTION_JSON;
    private String itemRelation = "item";
    private String renderHintExtension = "x-render-hint";
    private List<String> bodyMediaTypes = new ArrayList<>(HypermediaConfig.defaults().getBodyMediaTypes());

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getOpenapiLocation() {
        return openapiLocation;
    }

    public void setOpenapiLocation(String openapiLocation) {
        this.openapiLocation = openapiLocation;
    }

    public String getMediaType() {
        return mediaType;
    }

    public void setMediaType(String mediaType) {
        this.mediaType = mediaType;
    }

    public String getItemRelation() {
        return itemRelation;
    }

    public void setItemRelation(String itemRelation) {
        this.itemRelation = itemRelation;
    }

    public String getRenderHintExtension() {
        return renderHintExtension;
    }

    public void setRenderHintExtension(String renderHintExtension) {
        this.renderHintExtension = renderHintExtension;
    }

    public List<String> getBodyMediaTypes() {
        return bodyMediaTypes;
    }

    /**
     * Request body media types to read template fields from, in priority order.
     */
    public void setBodyMediaTypes(List<String> bodyMediaTypes) {
        this.bodyMediaTypes = bodyMediaTypes;
    }

    /**
     * Converts these settings into the core configuration object.
     */
    public HypermediaConfig toConfig() {
        return HypermediaConfig.builder()
                .mediaType(mediaType)
                .itemRelation(itemRelation)
                .renderHintExtension(renderHintExtension)
                .bodyMediaTypes(bodyMediaTypes)
                .build();
    }
}
