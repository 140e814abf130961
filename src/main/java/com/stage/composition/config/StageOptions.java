package com.stage.composition.config;

import com.stage.composition.cache.CacheConfig;
import com.stage.composition.core.PrimNameValidator;
import com.stage.composition.core.ValidationException;
import com.stage.composition.core.model.LayerStatus;
import org.eclipse.microprofile.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Options for composing and editing a stage.
 *
 * <p>Read from MicroProfile Config with {@link #fromConfig(Config)}:</p>
 * <pre>
 * stage-composition.changelog.layer=statement.usda
 * stage-composition.changelog.root=ChangeLog
 * stage-composition.namespace=primvars
 * stage-composition.default-status=Published
 * stage-composition.indent-width=4
 * stage-composition.cache.enabled=true
 * stage-composition.cache.max-size=256
 * stage-composition.cache.ttl-seconds=600
 * </pre>
 */
public class StageOptions {
    private static final Logger log = LoggerFactory.getLogger(StageOptions.class);

    public static final String PREFIX = "stage-composition.";

    private static final String DEFAULT_CHANGELOG_LAYER = "statement.usda";
    private static final String DEFAULT_CHANGELOG_ROOT = "ChangeLog";
    private static final String DEFAULT_NAMESPACE = "primvars";
    private static final int DEFAULT_INDENT_WIDTH = 4;
    private static final int MAX_INDENT_WIDTH = 16;

    private final String changelogLayer;
    private final String changelogRoot;
    private final String namespace;
    private final LayerStatus defaultStatus;
    private final int indentWidth;
    private final CacheConfig cacheConfig;

    private StageOptions(Builder builder) {
        this.changelogLayer = builder.changelogLayer;
        this.changelogRoot = builder.changelogRoot;
        this.namespace = builder.namespace;
        this.defaultStatus = builder.defaultStatus;
        this.indentWidth = builder.indentWidth;
        this.cacheConfig = builder.cacheConfig;
    }

    /**
     * Layer holding the change log and staged overrides.
     */
    public String getChangelogLayer() {
        return changelogLayer;
    }

    public String getChangelogRoot() {
        return changelogRoot;
    }

    /**
     * Property namespace whose prefix is dropped from property keys.
     */
    public String getNamespace() {
        return namespace;
    }

    /**
     * Status assumed for layers that are not in the stack.
     */
    public LayerStatus getDefaultStatus() {
        return defaultStatus;
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    public String getIndentUnit() {
        return " ".repeat(indentWidth);
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public static StageOptions defaults() {
        return builder().build();
    }

    /**
     * Reads {@code stage-composition.*} keys; absent keys keep their defaults.
     *
     * @throws ValidationException if a value is out of range or the status token is unknown
     */
    public static StageOptions fromConfig(Config config) {
        CacheConfig cacheDefaults = CacheConfig.defaults();
        boolean cacheEnabled = config.getOptionalValue(PREFIX + "cache.enabled", Boolean.class)
                .orElse(cacheDefaults.enabled());
        int cacheMaxLayers = config.getOptionalValue(PREFIX + "cache.max-size", Integer.class)
                .orElse(cacheDefaults.maxLayers());
        Duration cacheExpiry = config.getOptionalValue(PREFIX + "cache.ttl-seconds", Integer.class)
                .map(Duration::ofSeconds)
                .orElse(cacheDefaults.expireAfterAccess());

        CacheConfig cacheConfig;
        try {
            cacheConfig = cacheEnabled ? new CacheConfig(cacheMaxLayers, cacheExpiry, true) : CacheConfig.disabled();
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cache configuration: " + e.getMessage(), PREFIX + "cache", null);
        }

        StageOptions options = builder()
                .changelogLayer(config.getOptionalValue(PREFIX + "changelog.layer", String.class)
                        .orElse(DEFAULT_CHANGELOG_LAYER))
                .changelogRoot(config.getOptionalValue(PREFIX + "changelog.root", String.class)
                        .orElse(DEFAULT_CHANGELOG_ROOT))
                .namespace(config.getOptionalValue(PREFIX + "namespace", String.class)
                        .orElse(DEFAULT_NAMESPACE))
                .defaultStatus(config.getOptionalValue(PREFIX + "default-status", String.class)
                        .map(LayerStatus::fromToken)
                        .orElse(LayerStatus.PUBLISHED))
                .indentWidth(config.getOptionalValue(PREFIX + "indent-width", Integer.class)
                        .orElse(DEFAULT_INDENT_WIDTH))
                .cacheConfig(cacheConfig)
                .build();
        log.info("config.loaded changelogLayer={} namespace={} defaultStatus={} cacheEnabled={}",
                options.changelogLayer, options.namespace, options.defaultStatus.token(), cacheConfig.enabled());
        return options;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String changelogLayer = DEFAULT_CHANGELOG_LAYER;
        private String changelogRoot = DEFAULT_CHANGELOG_ROOT;
        private String namespace = DEFAULT_NAMESPACE;
        private LayerStatus defaultStatus = LayerStatus.PUBLISHED;
        private int indentWidth = DEFAULT_INDENT_WIDTH;
        private CacheConfig cacheConfig = CacheConfig.defaults();

        public Builder changelogLayer(String changelogLayer) {
            PrimNameValidator.validateFilePath(changelogLayer);
            this.changelogLayer = changelogLayer;
            return this;
        }

        public Builder changelogRoot(String changelogRoot) {
            PrimNameValidator.validatePrimName(changelogRoot);
            this.changelogRoot = changelogRoot;
            return this;
        }

        public Builder namespace(String namespace) {
            PrimNameValidator.validatePrimName(namespace);
            this.namespace = namespace;
            return this;
        }

        public Builder defaultStatus(LayerStatus defaultStatus) {
            if (defaultStatus == null) {
                throw new ValidationException("defaultStatus must not be null", "defaultStatus", null);
            }
            this.defaultStatus = defaultStatus;
            return this;
        }

        public Builder indentWidth(int indentWidth) {
            if (indentWidth < 1 || indentWidth > MAX_INDENT_WIDTH) {
                throw new ValidationException("indentWidth must be between 1 and " + MAX_INDENT_WIDTH,
                        "indentWidth", indentWidth);
            }
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            if (cacheConfig == null) {
                throw new ValidationException("cacheConfig must not be null", "cacheConfig", null);
            }
            this.cacheConfig = cacheConfig;
            return this;
        }

        public StageOptions build() {
            return new StageOptions(this);
        }
    }
}
