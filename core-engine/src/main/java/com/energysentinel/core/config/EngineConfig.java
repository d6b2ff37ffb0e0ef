package com.energysentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the typed engine configuration.
 *
 * <p>
 * Every section has defaults, so an empty YAML document yields a working
 * configuration. Populated once at startup by {@link EngineConfigLoader} and
 * not modified afterwards.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineConfig {

    private QualitySettings quality = new QualitySettings();
    private PreprocessingSettings preprocessing = new PreprocessingSettings();
    private ForecastSettings forecast = new ForecastSettings();
    private DetectionSettings detection = new DetectionSettings();
    private RegistrySettings registry = new RegistrySettings();
    private PipelineSettings pipeline = new PipelineSettings();

    /**
     * @return a configuration holding only defaults
     */
    public static EngineConfig defaults() {
        return new EngineConfig();
    }

    /**
     * Validate every section, reporting all problems at once.
     *
     * @throws IllegalStateException if any setting is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (quality == null || preprocessing == null || forecast == null
                || detection == null || registry == null || pipeline == null) {
            throw new IllegalStateException("Invalid engine configuration: sections must not be null");
        }
        quality.collectErrors(errors);
        preprocessing.collectErrors(errors);
        forecast.collectErrors(errors);
        detection.collectErrors(errors);
        registry.collectErrors(errors);
        pipeline.collectErrors(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid engine configuration: " + String.join("; ", errors));
        }
    }

    public QualitySettings getQuality() {
        return quality;
    }

    public void setQuality(QualitySettings quality) {
        this.quality = quality;
    }

    public PreprocessingSettings getPreprocessing() {
        return preprocessing;
    }

    public void setPreprocessing(PreprocessingSettings preprocessing) {
        this.preprocessing = preprocessing;
    }

    public ForecastSettings getForecast() {
        return forecast;
    }

    public void setForecast(ForecastSettings forecast) {
        this.forecast = forecast;
    }

    public DetectionSettings getDetection() {
        return detection;
    }

    public void setDetection(DetectionSettings detection) {
        this.detection = detection;
    }

    public RegistrySettings getRegistry() {
        return registry;
    }

    public void setRegistry(RegistrySettings registry) {
        this.registry = registry;
    }

    public PipelineSettings getPipeline() {
        return pipeline;
    }

    public void setPipeline(PipelineSettings pipeline) {
        this.pipeline = pipeline;
    }
}
