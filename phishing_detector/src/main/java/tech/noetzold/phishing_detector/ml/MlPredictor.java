package tech.noetzold.phishing_detector.ml;

import tech.noetzold.phishing_detector.model.MlPrediction;

import java.util.Map;

/**
 * Opaque supervised classifier: feature map in, label and probability out. May throw.
 */
@FunctionalInterface
public interface MlPredictor {
    MlPrediction predict(Map<String, Double> features) throws Exception;
}
