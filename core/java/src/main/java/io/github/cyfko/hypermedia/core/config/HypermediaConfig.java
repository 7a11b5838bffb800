package io.github.cyfko.hypermedia.core.config;

import java.util.List;
import java.util.Objects;

/**
 * Immutable configuration of the hypermedia layer.
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li>{@code mediaType}: {@value #COLLECTION_JSON}</li>
 *   <li>{@code itemRelation}: {@code item}</li>
 *   <li>{@code renderHintExtension}: {@code x-render-hint}</li>
 *   <li>{@code bodyMediaTypes}: {@code application/json}, then {@code application/x-www-form-urlencoded}</li>
 * </ul>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HypermediaConfig config = HypermediaConfig.builder()
 *     .renderHintExtension("x-widget")
 *     .build();
 * }</pre>
 *
 * @author cyfko
 * @since 1.0
 */
public final class HypermediaConfig {

    public static final String COLLECTION_JSON = "application/vnd.collection+json";

    private static final HypermediaConfig DEFAULTS = builder().build();

    private final String mediaType;
    private final String itemRelation;
    private final String renderHintExtension;
    private final List<String> bodyMediaTypes;

    private HypermediaConfig(Builder builder) {
        this.mediaType = builder.mediaType;
        this.itemRelation = builder.itemRelation;
        this.renderHintExtension = builder.renderHintExtension;
        this.bodyMediaTypes = List.copyOf(builder.bodyMediaTypes);
    }

    public static Builder builder() { return new Builder(); }

    public static HypermediaConfig defaults() { return DEFAULTS; }

    public String getMediaType() { return mediaType; }
    public String getItemRelation() { return itemRelation; }
    public String getRenderHintExtension() { return renderHintExtension; }
    public List<String> getBodyMediaTypes() { return bodyMediaTypes; }

    /**
     * Builder for {@link HypermediaConfig}.
     */
    public static final class Builder {
        private String mediaType = COLLECTION_JSON;
        private String itemRelation = "item";
        private String renderHintExtension = "x-render-hint";
        private List<String> bodyMediaTypes = List.of("application/json", "application/x-www-form-urlencoded");

        public Builder mediaType(String mediaType) {
            this.mediaType = requireText(mediaType, "mediaType");
            return this;
        }

        public Builder itemRelation(String itemRelation) {
            this.itemRelation = requireText(itemRelation, "itemRelation");
            return this;
        }

        public Builder renderHintExtension(String renderHintExtension) {
            this.renderHintExtension = requireText(renderHintExtension, "renderHintExtension");
            return this;
        }

        public Builder bodyMediaTypes(List<String> bodyMediaTypes) {
            Objects.requireNonNull(bodyMediaTypes, "bodyMediaTypes");
            if (bodyMediaTypes.isEmpty()) {
                throw new IllegalArgumentException("bodyMediaTypes must not be empty");
            }
            this.bodyMediaTypes = bodyMediaTypes;
            return this;
        }

        public HypermediaConfig build() { return new HypermediaConfig(this); }

        private static String requireText(String value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be blank");
            }
            return value.trim();
        }
    }
}
