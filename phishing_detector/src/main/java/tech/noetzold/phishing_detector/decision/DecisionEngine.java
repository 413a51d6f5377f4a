package tech.noetzold.phishing_detector.decision;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.noetzold.phishing_detector.config.DecisionSettings;
import tech.noetzold.phishing_detector.model.ByteSequence;
import tech.noetzold.phishing_detector.model.ClassificationResult;
import tech.noetzold.phishing_detector.model.ClusterScore;
import tech.noetzold.phishing_detector.model.Confidence;
import tech.noetzold.phishing_detector.model.DecisionSource;
import tech.noetzold.phishing_detector.model.DetectionMode;
import tech.noetzold.phishing_detector.model.MlPrediction;
import tech.noetzold.phishing_detector.model.MlSignal;
import tech.noetzold.phishing_detector.model.ScoreBundle;
import tech.noetzold.phishing_detector.model.ScoringStrategy;
import tech.noetzold.phishing_detector.model.Verdict;
import tech.noetzold.phishing_detector.ncd.NcdMetric;
import tech.noetzold.phishing_detector.prototype.Prototype;
import tech.noetzold.phishing_detector.prototype.PrototypeCluster;
import tech.noetzold.phishing_detector.prototype.PrototypeStore;
import tech.noetzold.phishing_detector.prototype.PrototypeStoreHolder;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns distances to the prototype store into a verdict.
 *
 * <p>Per request: score the subject against every legitimate prototype and every phishing
 * cluster, bias small subjects towards phishing, compare best matches, then let a confident
 * ML prediction override the result. Holds no per-request state, so calls may run
 * concurrently.</p>
 */
@Slf4j
@Component
public class DecisionEngine {

    static final String NO_PROTOTYPES = "No prototypes available";

    private final PrototypeStoreHolder stores;
    private final NcdMetric metric;
    private final DecisionSettings settings;

    public DecisionEngine(PrototypeStoreHolder stores, NcdMetric metric, DecisionSettings settings) {
        this.stores = stores;
        this.metric = metric;
        this.settings = settings;
    }

    public ClassificationResult classify(ByteSequence subject, DetectionMode mode) {
        return classify(subject, mode, MlSignal.disabled());
    }

    public ClassificationResult classify(ByteSequence subject, DetectionMode mode, MlSignal ml) {
        PrototypeStore store = stores.current();
        return decide(score(subject, store), store, mode, ml);
    }

    public ScoreBundle score(ByteSequence subject) {
        return score(subject, stores.current());
    }

    ScoreBundle score(ByteSequence subject, PrototypeStore store) {
        int size = subject.length();
        if (subject.isEmpty()) {
            log.warn("Empty subject; scoring at maximal distance");
            return new ScoreBundle(ScoreBundle.MAX_DISTANCE, ScoreBundle.MAX_DISTANCE,
                    ScoreBundle.MAX_DISTANCE, ScoreBundle.MAX_DISTANCE, List.of(), null,
                    store.hasPhish(), store.hasLegit(), 0);
        }

        double legitMin = ScoreBundle.MAX_DISTANCE;
        double legitAvg = ScoreBundle.MAX_DISTANCE;
        if (store.hasLegit()) {
            double[] s = distances(subject, store.legit());
            legitMin = min(s);
            legitAvg = mean(s);
        }

        List<ClusterScore> clusters = new ArrayList<>();
        for (PrototypeCluster cluster : store.phishClusters()) {
            double[] s = distances(subject, cluster.members());
            clusters.add(new ClusterScore(cluster.id(), min(s), mean(s), cluster.size()));
        }

        double phishMin = ScoreBundle.MAX_DISTANCE;
        double phishAvg = ScoreBundle.MAX_DISTANCE;
        Integer best = null;
        if (!clusters.isEmpty()) {
            double avgSum = 0.0;
            for (ClusterScore c : clusters) {
                if (best == null || c.min() < phishMin) {
                    phishMin = c.min();
                    best = c.cluster();
                }
                avgSum += c.avg();
            }
            phishAvg = avgSum / clusters.size();
        }

        return new ScoreBundle(phishMin, phishAvg, legitMin, legitAvg, clusters, best,
                store.hasPhish(), store.hasLegit(), size);
    }

    public ClassificationResult decide(ScoreBundle scores, DetectionMode mode, MlSignal ml) {
        return decide(scores, stores.current(), mode, ml);
    }

    ClassificationResult decide(ScoreBundle scores, PrototypeStore store, DetectionMode mode, MlSignal ml) {
        DecisionSource source = store.strategy().source();

        boolean minimal = scores.subjectSize() < settings.minimalDomThreshold();
        double penalty = minimal ? settings.minimalDomPenalty() : 0.0;
        double legitMinAdj = scores.legitMin() + penalty;
        double legitAvgAdj = scores.legitAvg() + penalty;

        Verdict ncdVerdict;
        Confidence confidence;
        StringBuilder reason = new StringBuilder();

        if (!scores.phishAvailable() || !scores.legitAvailable()) {
            ncdVerdict = Verdict.UNKNOWN;
            confidence = Confidence.LOW;
            reason.append(NO_PROTOTYPES).append(" (phishing=").append(store.phishCount())
                    .append(", legitimate=").append(store.legitCount())
                    .append("). Run the prototype build tool first.");
            log.warn("Classification without a complete prototype store: phish={}, legit={}",
                    store.phishCount(), store.legitCount());
        } else {
            if (scores.subjectSize() == 0) {
                reason.append("Empty subject scored at maximal distance. ");
            }
            ncdVerdict = scores.phishMin() < legitMinAdj ? Verdict.PHISH : Verdict.LEGIT;
            confidence = confidenceFor(Math.abs(scores.phishMin() - legitMinAdj));
            describe(reason, ncdVerdict, scores, legitMinAdj, legitAvgAdj, minimal, penalty);
        }

        Verdict finalVerdict = ncdVerdict;
        DecisionSource decisionSource = source;
        MlPrediction prediction = null;

        if (ml instanceof MlSignal.Ok ok) {
            prediction = ok.prediction();
            if (prediction.probability() >= settings.mlConfidenceThreshold()) {
                finalVerdict = Verdict.of(prediction.label());
                decisionSource = DecisionSource.ML;
                reason.append(String.format(" ML prediction %s (%.4f) meets threshold %.2f and decides.",
                        prediction.label().tag(), prediction.probability(), settings.mlConfidenceThreshold()));
            } else {
                reason.append(String.format(" ML prediction %s (%.4f) below threshold %.2f; NCD verdict kept.",
                        prediction.label().tag(), prediction.probability(), settings.mlConfidenceThreshold()));
            }
        } else if (ml instanceof MlSignal.Unavailable u && u.failed()) {
            decisionSource = DecisionSource.NCD_FALLBACK;
            reason.append(" ML unavailable (").append(u.reason()).append("); NCD verdict kept.");
        }

        log.info("Classification: {} via {} (ncd={}, phish_min={}, legit_min={}, legit_min_adj={}, minimal_adj={}, mode={})",
                finalVerdict.tag(), decisionSource.tag(), ncdVerdict.tag(),
                fmt(scores.phishMin()), fmt(scores.legitMin()), fmt(legitMinAdj), minimal,
                mode == null ? null : mode.tag());

        return new ClassificationResult(
                finalVerdict,
                ncdVerdict,
                scores.phishMin(),
                scores.phishAvg(),
                scores.legitMin(),
                scores.legitAvg(),
                legitMinAdj,
                legitAvgAdj,
                store.strategy() == ScoringStrategy.CLUSTERED ? scores.bestCluster() : null,
                scores.clusters(),
                scores.subjectSize(),
                minimal,
                confidence,
                reason.toString().trim(),
                source,
                decisionSource,
                mode,
                prediction
        );
    }

    Confidence confidenceFor(double separation) {
        if (separation > settings.highSeparation()) return Confidence.HIGH;
        if (separation > settings.lowSeparation()) return Confidence.MEDIUM;
        return Confidence.LOW;
    }

    private void describe(StringBuilder reason, Verdict verdict, ScoreBundle s,
                          double legitMinAdj, double legitAvgAdj, boolean minimal, double penalty) {
        reason.append("Classified as ").append(verdict.tag()).append(". ")
                .append(String.format("Phishing prototype distances: min=%.4f, avg=%.4f", s.phishMin(), s.phishAvg()));
        if (s.bestCluster() != null && s.clusters().size() > 1) {
            reason.append(" (best cluster ").append(s.bestCluster()).append(")");
        }
        reason.append(String.format(". Legitimate prototype distances: min=%.4f, avg=%.4f. ", s.legitMin(), s.legitAvg()));
        if (minimal) {
            reason.append(String.format("Minimal DOM penalty applied (+%.2f, %d bytes). ", penalty, s.subjectSize()));
        }
        String legitShown = minimal
                ? String.format("%.4f, original: %.4f", legitMinAdj, s.legitMin())
                : String.format("%.4f", s.legitMin());
        if (verdict == Verdict.PHISH) {
            reason.append(String.format("Phishing prototype match (%.4f) better than %slegitimate (%s).",
                    s.phishMin(), minimal ? "adjusted " : "", legitShown));
        } else {
            reason.append(String.format("Legitimate prototype match (%s) better than phishing (%.4f).",
                    legitShown, s.phishMin()));
        }
    }

    private double[] distances(ByteSequence subject, List<Prototype> prototypes) {
        double[] out = new double[prototypes.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = metric.distance(subject, prototypes.get(i).content());
        }
        return out;
    }

    private static double min(double[] values) {
        double m = Double.POSITIVE_INFINITY;
        for (double v : values) m = Math.min(m, v);
        return m;
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    private static String fmt(double v) {
        return String.format("%.4f", v);
    }
}
