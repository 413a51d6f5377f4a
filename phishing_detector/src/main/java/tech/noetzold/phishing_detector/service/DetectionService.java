package tech.noetzold.phishing_detector.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.phishing_detector.config.DecisionSettings;
import tech.noetzold.phishing_detector.decision.DecisionEngine;
import tech.noetzold.phishing_detector.ml.MlSignalFacade;
import tech.noetzold.phishing_detector.model.ByteSequence;
import tech.noetzold.phishing_detector.model.ClassificationResult;
import tech.noetzold.phishing_detector.model.Confidence;
import tech.noetzold.phishing_detector.model.DetectionMode;
import tech.noetzold.phishing_detector.model.MlSignal;
import tech.noetzold.phishing_detector.model.ScoreBundle;
import tech.noetzold.phishing_detector.model.Verdict;
import tech.noetzold.phishing_detector.page.DomSanitizer;
import tech.noetzold.phishing_detector.page.FeatureExtractor;
import tech.noetzold.phishing_detector.page.ResourceSignatureExtractor;
import tech.noetzold.phishing_detector.prototype.PrototypeStoreHolder;

import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class DetectionService {

    static final String NOT_RENDERED = "Page could not be rendered";

    private final DomSanitizer sanitizer;
    private final ResourceSignatureExtractor resourceSignatures;
    private final FeatureExtractor features;
    private final DecisionEngine engine;
    private final MlSignalFacade ml;
    private final PrototypeStoreHolder stores;
    private final DecisionSettings settings;

    public DetectionService(DomSanitizer sanitizer,
                            ResourceSignatureExtractor resourceSignatures,
                            FeatureExtractor features,
                            DecisionEngine engine,
                            MlSignalFacade ml,
                            PrototypeStoreHolder stores,
                            DecisionSettings settings) {
        this.sanitizer = sanitizer;
        this.resourceSignatures = resourceSignatures;
        this.features = features;
        this.engine = engine;
        this.ml = ml;
        this.stores = stores;
        this.settings = settings;
    }

    /**
     * Classifies one rendered page. The small-DOM switch to resource signatures happens
     * here; everything after the subject is chosen lives in {@link DecisionEngine}.
     */
    public ClassificationResult detect(String url, String html) {
        if (html == null || html.isBlank()) {
            log.error("No rendered HTML for {}", url);
            return notRendered();
        }

        ByteSequence dom = sanitizer.sanitize(html);
        DetectionMode mode = DetectionMode.DOM_STRUCTURE;
        ByteSequence subject = dom;
        if (dom.length() < settings.smallDomThreshold()) {
            log.info("Small DOM detected ({} < {}), switching to resource signature mode",
                    dom.length(), settings.smallDomThreshold());
            mode = DetectionMode.RESOURCE_SIGNATURE;
            subject = resourceSignatures.extract(html, url);
        }

        ScoreBundle scores = engine.score(subject);
        MlSignal signal = MlSignal.disabled();
        if (ml.enabled()) {
            Map<String, Double> vector = features.extract(html, scores);
            signal = ml.predict(vector);
        }
        return engine.decide(scores, mode, signal);
    }

    private ClassificationResult notRendered() {
        double max = ScoreBundle.MAX_DISTANCE;
        return new ClassificationResult(
                Verdict.UNKNOWN, Verdict.UNKNOWN,
                max, max, max, max, max, max,
                null, List.of(), 0, false,
                Confidence.LOW,
                NOT_RENDERED,
                stores.strategy().source(),
                stores.strategy().source(),
                DetectionMode.DOM_STRUCTURE,
                null
        );
    }
}
