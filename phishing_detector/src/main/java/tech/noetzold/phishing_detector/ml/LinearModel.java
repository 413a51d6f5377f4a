package tech.noetzold.phishing_detector.ml;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * JSON export of a trained logistic-regression model and its standard scaler.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LinearModel(
        @JsonProperty("model_type") String modelType,
        @JsonProperty("feature_order") List<String> featureOrder,
        List<Double> mean,
        List<Double> scale,
        List<Double> coefficients,
        double intercept
) {
    public LinearModel {
        int n = featureOrder == null ? 0 : featureOrder.size();
        if (n == 0) {
            throw new IllegalArgumentException("model has no features");
        }
        if (mean == null || scale == null || coefficients == null
                || mean.size() != n || scale.size() != n || coefficients.size() != n) {
            throw new IllegalArgumentException("mean, scale and coefficients must each have " + n + " entries");
        }
        featureOrder = List.copyOf(featureOrder);
        mean = List.copyOf(mean);
        scale = List.copyOf(scale);
        coefficients = List.copyOf(coefficients);
    }
}
