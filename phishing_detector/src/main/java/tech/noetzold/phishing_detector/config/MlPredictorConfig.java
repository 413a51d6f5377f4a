package tech.noetzold.phishing_detector.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import tech.noetzold.phishing_detector.ml.LinearModelPredictor;
import tech.noetzold.phishing_detector.ml.MlPredictor;
import tech.noetzold.phishing_detector.ml.RemoteMlPredictorClient;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Registers at most one {@link MlPredictor}, chosen by {@code detector.ml.mode}. With no
 * predictor bean the ML signal is reported as disabled.
 */
@Slf4j
@Configuration
public class MlPredictorConfig {

    @Bean
    @ConditionalOnProperty(name = "detector.ml.mode", havingValue = "remote")
    public WebClient mlWebClient(@Value("${detector.ml.base-url:http://ml-service:8090}") String baseUrl) {
        return WebClient.builder()
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "detector.ml.mode", havingValue = "remote")
    public MlPredictor remoteMlPredictor(WebClient mlWebClient,
                                         @Value("${detector.ml.timeout-ms:1500}") long timeoutMs) {
        log.info("ML fusion enabled: remote predictor");
        return new RemoteMlPredictorClient(mlWebClient, Duration.ofMillis(timeoutMs));
    }

    @Bean
    @ConditionalOnProperty(name = "detector.ml.mode", havingValue = "linear")
    public MlPredictor linearMlPredictor(@Value("${detector.ml.model-path:models/phishing_model.json}") Path modelPath,
                                         ObjectMapper objectMapper) {
        try {
            return LinearModelPredictor.load(modelPath, objectMapper);
        } catch (IOException | IllegalArgumentException e) {
            log.warn("ML model could not be loaded from {}: {}. Predictions will fall back to NCD.",
                    modelPath, e.getMessage());
            String reason = "model not loaded: " + e.getMessage();
            return features -> {
                throw new IllegalStateException(reason);
            };
        }
    }
}
