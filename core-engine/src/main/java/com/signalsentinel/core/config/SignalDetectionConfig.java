package com.signalsentinel.core.config;

import com.signalsentinel.core.exception.InvalidConfigurationException;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the signal detection YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key optional, defaults shown in
 * {@code signal-detection.yml}):
 * </p>
 *
 * <pre>
 * disproportionality:
 *   prrThreshold: 2.0
 *   minCount: 3
 * bayesian:
 *   eb05Threshold: 2.0
 *   fdrTarget: 0.05
 * temporal:
 *   spikeWindow: 30
 * layer1:
 *   rarityWeight: 0.40
 * layer2:
 *   frequencyWeight: 0.25
 * fusion:
 *   evidenceWeight: 0.35
 * engine:
 *   parallelism: 4
 * </pre>
 *
 * <p>
 * The engine treats an instance as read-only for the duration of a batch.
 * Call {@link #validate()} after loading or after programmatic changes.
 * </p>
 *
 * @since 1.0.0
 */
public class SignalDetectionConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private DisproportionalitySettings disproportionality = new DisproportionalitySettings();
    private BayesianSettings bayesian = new BayesianSettings();
    private CausalitySettings causality = new CausalitySettings();
    private TemporalSettings temporal = new TemporalSettings();
    private Layer1Settings layer1 = new Layer1Settings();
    private Layer2Settings layer2 = new Layer2Settings();
    private FusionSettings fusion = new FusionSettings();
    private EngineSettings engine = new EngineSettings();

    /**
     * @return a configuration holding every default value
     */
    public static SignalDetectionConfig defaults() {
        return new SignalDetectionConfig();
    }

    /**
     * Validate every section.
     *
     * <p>
     * Collects all errors and throws a single exception if any value is
     * invalid.
     * </p>
     *
     * @throws InvalidConfigurationException if one or more values are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        disproportionality.validate(errors);
        bayesian.validate(errors);
        causality.validate(errors);
        temporal.validate(errors);
        layer1.validate(errors);
        layer2.validate(errors);
        fusion.validate(errors);
        engine.validate(errors);

        if (!errors.isEmpty()) {
            throw new InvalidConfigurationException(errors);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for SnakeYAML)
    // ---------------------------------------------------------------

    public DisproportionalitySettings getDisproportionality() {
        return disproportionality;
    }

    public void setDisproportionality(DisproportionalitySettings disproportionality) {
        this.disproportionality = disproportionality != null ? disproportionality : new DisproportionalitySettings();
    }

    public BayesianSettings getBayesian() {
        return bayesian;
    }

    public void setBayesian(BayesianSettings bayesian) {
        this.bayesian = bayesian != null ? bayesian : new BayesianSettings();
    }

    public CausalitySettings getCausality() {
        return causality;
    }

    public void setCausality(CausalitySettings causality) {
        this.causality = causality != null ? causality : new CausalitySettings();
    }

    public TemporalSettings getTemporal() {
        return temporal;
    }

    public void setTemporal(TemporalSettings temporal) {
        this.temporal = temporal != null ? temporal : new TemporalSettings();
    }

    public Layer1Settings getLayer1() {
        return layer1;
    }

    public void setLayer1(Layer1Settings layer1) {
        this.layer1 = layer1 != null ? layer1 : new Layer1Settings();
    }

    public Layer2Settings getLayer2() {
        return layer2;
    }

    public void setLayer2(Layer2Settings layer2) {
        this.layer2 = layer2 != null ? layer2 : new Layer2Settings();
    }

    public FusionSettings getFusion() {
        return fusion;
    }

    public void setFusion(FusionSettings fusion) {
        this.fusion = fusion != null ? fusion : new FusionSettings();
    }

    public EngineSettings getEngine() {
        return engine;
    }

    public void setEngine(EngineSettings engine) {
        this.engine = engine != null ? engine : new EngineSettings();
    }

    @Override
    public String toString() {
        return "SignalDetectionConfig{" +
                disproportionality + ", " +
                bayesian + ", " +
                causality + ", " +
                temporal + ", " +
                layer1 + ", " +
                layer2 + ", " +
                fusion + ", " +
                engine + '}';
    }
}
