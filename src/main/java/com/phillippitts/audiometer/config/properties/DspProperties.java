package com.phillippitts.audiometer.config.properties;

import com.phillippitts.audiometer.domain.DspParameters;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Starting DSP parameters for new sessions, before any {@code set_params} arrives.
 */
@Validated
@ConfigurationProperties(prefix = "dsp")
public class DspProperties {

    @DecimalMin("0.0")
    @DecimalMax("60.0")
    private final double defaultGainDb;

    private final boolean defaultFilterEnabled;

    @DecimalMin("20.0")
    @DecimalMax("96000.0")
    private final double defaultCutoffHz;

    @DecimalMin("0.01")
    @DecimalMax("10.0")
    private final double defaultIntegrationTime;

    @ConstructorBinding
    public DspProperties(Double defaultGainDb,
                         Boolean defaultFilterEnabled,
                         Double defaultCutoffHz,
                         Double defaultIntegrationTime) {
        this.defaultGainDb = defaultGainDb == null ? DspParameters.DEFAULTS.gainDb() : defaultGainDb;
        this.defaultFilterEnabled = defaultFilterEnabled == null
                ? DspParameters.DEFAULTS.filterEnabled() : defaultFilterEnabled;
        this.defaultCutoffHz = defaultCutoffHz == null ? DspParameters.DEFAULTS.cutoffHz() : defaultCutoffHz;
        this.defaultIntegrationTime = defaultIntegrationTime == null
                ? DspParameters.DEFAULTS.integrationTimeSeconds() : defaultIntegrationTime;
    }

    public double getDefaultGainDb() { return defaultGainDb; }
    public boolean isDefaultFilterEnabled() { return defaultFilterEnabled; }
    public double getDefaultCutoffHz() { return defaultCutoffHz; }
    public double getDefaultIntegrationTime() { return defaultIntegrationTime; }

    /** @return the configured defaults as parameters (unclamped; sessions clamp per sample rate) */
    public DspParameters toParameters() {
        return new DspParameters(defaultGainDb, defaultFilterEnabled, defaultCutoffHz, defaultIntegrationTime);
    }
}
