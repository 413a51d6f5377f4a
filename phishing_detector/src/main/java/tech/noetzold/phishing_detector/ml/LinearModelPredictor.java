package tech.noetzold.phishing_detector.ml;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import tech.noetzold.phishing_detector.model.Label;
import tech.noetzold.phishing_detector.model.MlPrediction;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Evaluates an exported logistic-regression model in-process. Features missing from the
 * map count as 0.0, as in training.
 */
@Slf4j
public class LinearModelPredictor implements MlPredictor {

    private final LinearModel model;

    public LinearModelPredictor(LinearModel model) {
        this.model = model;
    }

    public static LinearModelPredictor load(Path path, ObjectMapper objectMapper) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Model file not found: " + path);
        }
        LinearModel model = objectMapper.readValue(path.toFile(), LinearModel.class);
        log.info("ML model loaded from {} ({}, {} features)", path, model.modelType(), model.featureOrder().size());
        return new LinearModelPredictor(model);
    }

    @Override
    public MlPrediction predict(Map<String, Double> features) {
        double z = model.intercept();
        for (int i = 0; i < model.featureOrder().size(); i++) {
            double x = features.getOrDefault(model.featureOrder().get(i), 0.0);
            double scale = model.scale().get(i);
            double scaled = (x - model.mean().get(i)) / (scale == 0.0 ? 1.0 : scale);
            z += model.coefficients().get(i) * scaled;
        }
        double phish = 1.0 / (1.0 + Math.exp(-z));
        return phish >= 0.5
                ? new MlPrediction(Label.PHISH, phish)
                : new MlPrediction(Label.LEGIT, 1.0 - phish);
    }
}
