package tech.noetzold.phishing_detector.ml;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import tech.noetzold.phishing_detector.model.MlPrediction;
import tech.noetzold.phishing_detector.model.MlSignal;

import java.util.Map;

/**
 * Asks the configured {@link MlPredictor}, if any, and reports the outcome as an
 * {@link MlSignal}. Exceptions and malformed predictions never reach the caller.
 */
@Slf4j
@Component
public class MlSignalFacade {

    private final MlPredictor predictor;

    @Autowired
    public MlSignalFacade(ObjectProvider<MlPredictor> predictor) {
        this(predictor.getIfAvailable());
    }

    public MlSignalFacade(MlPredictor predictor) {
        this.predictor = predictor;
    }

    public boolean enabled() {
        return predictor != null;
    }

    public MlSignal predict(Map<String, Double> features) {
        if (predictor == null) {
            return MlSignal.disabled();
        }
        if (features == null || features.isEmpty()) {
            log.warn("No features extracted; skipping ML prediction");
            return MlSignal.failed("no features");
        }

        MlPrediction prediction;
        try {
            prediction = predictor.predict(features);
        } catch (Exception e) {
            log.error("ML prediction failed: {}. Using NCD result only.", e.getMessage());
            return MlSignal.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (prediction == null || prediction.label() == null) {
            log.warn("ML predictor returned no label; ignoring");
            return MlSignal.failed("malformed prediction: missing label");
        }
        double p = prediction.probability();
        if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
            log.warn("ML predictor returned probability {} outside [0, 1]; ignoring", p);
            return MlSignal.failed("malformed prediction: probability " + p);
        }
        log.info("ML prediction: {} (confidence: {})", prediction.label().tag(), String.format("%.4f", p));
        return new MlSignal.Ok(prediction);
    }
}
