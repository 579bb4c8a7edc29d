package fr.lapetina.aperture.infrastructure.config;

import fr.lapetina.aperture.domain.aperture.ApertureSettings;

import java.util.function.Supplier;

/**
 * {@link ApertureSettings} backed by the live configuration.
 *
 * Every call reads the configuration currently held by the loader, so a hot
 * reload takes effect on the next rebuild. A missing configuration or section
 * yields the defaults of {@link ApertureConfig.ApertureSection}.
 */
public final class ConfigApertureSettings implements ApertureSettings {

    private static final ApertureConfig.ApertureSection DEFAULTS = new ApertureConfig.ApertureSection();

    private final Supplier<ApertureConfig> config;

    public ConfigApertureSettings(Supplier<ApertureConfig> config) {
        this.config = config;
    }

    public ConfigApertureSettings(ConfigLoader loader) {
        this(loader::getCurrentConfig);
    }

    private ApertureConfig.ApertureSection section() {
        ApertureConfig current = config.get();
        if (current == null || current.getAperture() == null) {
            return DEFAULTS;
        }
        return current.getAperture();
    }

    @Override
    public int minAperture() {
        return section().getMinAperture();
    }

    @Override
    public int initAperture() {
        return section().getInitAperture();
    }

    @Override
    public boolean dapertureActive() {
        return section().isDapertureActive();
    }

    @Override
    public boolean eagerConnections() {
        return section().isEagerConnections();
    }
}
