package tech.noetzold.phishing_detector.ml;

import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.phishing_detector.model.Label;
import tech.noetzold.phishing_detector.model.MlPrediction;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Calls a model-serving endpoint: {@code POST /predict} with {@code {"features": {...}}},
 * expecting {@code {"label": "phish"|"legit", "probability": 0..1}} back.
 */
public class RemoteMlPredictorClient implements MlPredictor {

    private final WebClient webClient;
    private final Duration timeout;

    public RemoteMlPredictorClient(WebClient mlWebClient, Duration timeout) {
        this.webClient = mlWebClient;
        this.timeout = timeout;
    }

    @Override
    public MlPrediction predict(Map<String, Double> features) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("features", features);
        payload.put("return_probabilities", true);

        PredictResponse body = webClient.post()
                .uri("/predict")
                .bodyValue(payload)
                .exchangeToMono(resp -> {
                    HttpStatusCode status = resp.statusCode();
                    if (status.is2xxSuccessful()) {
                        return resp.bodyToMono(PredictResponse.class);
                    }
                    return resp.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .<PredictResponse>flatMap(err -> Mono.error(new IllegalStateException(
                                    "model service answered " + status.value() + " " + err)));
                })
                .timeout(timeout)
                .block();

        if (body == null) {
            throw new IllegalStateException("model service returned an empty body");
        }
        if (body.label() == null) {
            throw new IllegalStateException("model service response has no label");
        }
        if (body.probability() == null) {
            throw new IllegalStateException("model service response has no probability");
        }
        return new MlPrediction(Label.fromTag(body.label()), body.probability());
    }

    record PredictResponse(String label, Double probability) {}
}
