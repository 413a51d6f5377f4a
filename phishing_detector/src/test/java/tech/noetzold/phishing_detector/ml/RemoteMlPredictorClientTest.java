package tech.noetzold.phishing_detector.ml;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tech.noetzold.phishing_detector.model.Label;
import tech.noetzold.phishing_detector.model.MlPrediction;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RemoteMlPredictorClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private RemoteMlPredictorClient client(HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
                .baseUrl("http://ml-service:8090")
                .exchangeFunction(request -> {
                    requests.add(request);
                    return Mono.just(ClientResponse.create(status)
                            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                            .body(body)
                            .build());
                })
                .build();
        return new RemoteMlPredictorClient(webClient, Duration.ofSeconds(2));
    }

    @Test
    void postsFeaturesAndReadsPrediction() {
        RemoteMlPredictorClient client = client(HttpStatus.OK, "{\"label\":\"phishing\",\"probability\":0.91}");

        MlPrediction p = client.predict(Map.of("count_form", 2.0));

        assertEquals(Label.PHISH, p.label());
        assertEquals(0.91, p.probability());
        assertEquals(1, requests.size());
        assertEquals("/predict", requests.get(0).url().getPath());
        assertEquals("POST", requests.get(0).method().name());
    }

    @Test
    void errorStatusIsRaised() {
        RemoteMlPredictorClient client = client(HttpStatus.SERVICE_UNAVAILABLE, "{\"detail\":\"model not loaded\"}");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> client.predict(Map.of("x", 1.0)));
        assertTrue(e.getMessage().contains("503"));
    }

    @Test
    void responseWithoutLabelIsRejected() {
        RemoteMlPredictorClient client = client(HttpStatus.OK, "{\"probability\":0.7}");

        assertThrows(IllegalStateException.class, () -> client.predict(Map.of("x", 1.0)));
    }

    @Test
    void responseWithoutProbabilityIsRejected() {
        RemoteMlPredictorClient client = client(HttpStatus.OK, "{\"label\":\"phish\"}");

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> client.predict(Map.of("x", 1.0)));
        assertTrue(e.getMessage().contains("probability"));
    }
}
