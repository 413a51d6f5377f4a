package tech.noetzold.phishing_detector.decision;

import org.junit.jupiter.api.Test;
import tech.noetzold.phishing_detector.config.DecisionSettings;
import tech.noetzold.phishing_detector.model.ByteSequence;
import tech.noetzold.phishing_detector.model.ClassificationResult;
import tech.noetzold.phishing_detector.model.ClusterScore;
import tech.noetzold.phishing_detector.model.Confidence;
import tech.noetzold.phishing_detector.model.DecisionSource;
import tech.noetzold.phishing_detector.model.DetectionMode;
import tech.noetzold.phishing_detector.model.Label;
import tech.noetzold.phishing_detector.model.MlSignal;
import tech.noetzold.phishing_detector.model.ScoreBundle;
import tech.noetzold.phishing_detector.model.ScoringStrategy;
import tech.noetzold.phishing_detector.model.Verdict;
import tech.noetzold.phishing_detector.ncd.CompressionOracle;
import tech.noetzold.phishing_detector.ncd.NcdMetric;
import tech.noetzold.phishing_detector.prototype.Prototype;
import tech.noetzold.phishing_detector.prototype.PrototypeCluster;
import tech.noetzold.phishing_detector.prototype.PrototypeStore;
import tech.noetzold.phishing_detector.prototype.PrototypeStoreHolder;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DecisionEngineTest {

    private static final String LOGIN = "html head title body div form label input label input button a ";
    private static final String WALLET = "html head script script body div iframe div img ";
    private static final String NEWS = "html head meta meta link body header nav ul li li li main article p p p footer ";

    private final NcdMetric metric = new NcdMetric(new CompressionOracle(6, 1000));
    private final DecisionSettings settings = DecisionSettings.defaults();

    private final Prototype login = proto("p1", LOGIN.repeat(20), Label.PHISH, 1);
    private final Prototype wallet = proto("p2", WALLET.repeat(25), Label.PHISH, 2);
    private final Prototype walletAlt = proto("p3", WALLET.repeat(24) + "span span ", Label.PHISH, 2);
    private final Prototype news = proto("l1", NEWS.repeat(15), Label.LEGIT, null);

    private final PrototypeStore clustered = PrototypeStore.clustered(
            List.of(new PrototypeCluster(1, List.of(login)), new PrototypeCluster(2, List.of(wallet, walletAlt))),
            List.of(news));

    private DecisionEngine engine(PrototypeStore store, DecisionSettings s) {
        return new DecisionEngine(new PrototypeStoreHolder(strategy -> store, store.strategy()), metric, s);
    }

    private DecisionEngine engine(PrototypeStore store) {
        return engine(store, settings);
    }

    @Test
    void subjectIdenticalToLegitPrototypeIsLegit() {
        DecisionEngine engine = engine(clustered, new DecisionSettings(10, 0.05, 0.10, 0.05, 0.6, 2000));

        ClassificationResult r = engine.classify(news.content(), DetectionMode.DOM_STRUCTURE);

        assertEquals(0.0, r.legit_min());
        assertTrue(r.phish_min() > 0.0);
        assertEquals(Verdict.LEGIT, r.verdict());
        assertEquals(Confidence.HIGH, r.confidence());
        assertFalse(r.minimal_dom_adjustment_applied());
        assertEquals(DecisionSource.NCD_CLUSTERED, r.decision_source());
    }

    @Test
    void bestClusterIsTheOneHoldingTheClosestPrototype() {
        ScoreBundle scores = engine(clustered).score(wallet.content());

        assertEquals(0.0, scores.phishMin());
        assertEquals(Integer.valueOf(2), scores.bestCluster());
        assertEquals(2, scores.clusters().size());
        ClusterScore c1 = scores.clusters().get(0);
        ClusterScore c2 = scores.clusters().get(1);
        assertEquals(1, c1.cluster());
        assertEquals(2, c2.prototypes());
        assertEquals((c1.avg() + c2.avg()) / 2, scores.phishAvg(), 1e-12);

        ClassificationResult r = engine(clustered).classify(wallet.content(), DetectionMode.DOM_STRUCTURE);
        assertEquals(Verdict.PHISH, r.verdict());
        assertEquals(Integer.valueOf(2), r.best_cluster());
    }

    @Test
    void emptyStoreIsUnknown() {
        PrototypeStore empty = PrototypeStore.empty(ScoringStrategy.CLUSTERED);

        ClassificationResult r = engine(empty).classify(ByteSequence.utf8(LOGIN.repeat(20)), DetectionMode.DOM_STRUCTURE);

        assertEquals(Verdict.UNKNOWN, r.verdict());
        assertEquals(1.0, r.phish_min());
        assertEquals(1.0, r.legit_min());
        assertTrue(r.reason().startsWith(DecisionEngine.NO_PROTOTYPES));
        assertNull(r.best_cluster());
    }

    @Test
    void oneMissingClassIsAlsoUnknown() {
        PrototypeStore phishOnly = PrototypeStore.clustered(List.of(new PrototypeCluster(1, List.of(login))), List.of());

        ClassificationResult r = engine(phishOnly).classify(login.content(), DetectionMode.DOM_STRUCTURE);

        assertEquals(Verdict.UNKNOWN, r.verdict());
        assertEquals(0.0, r.phish_min());
        assertEquals(1.0, r.legit_min());
        assertTrue(r.reason().contains("legitimate=0"));
    }

    @Test
    void equalDistancesOnSmallSubjectTipTowardsPhish() {
        ByteSequence shared = ByteSequence.utf8(LOGIN.repeat(10));
        PrototypeStore store = PrototypeStore.flat(
                List.of(new Prototype("p", shared, Label.PHISH, 1, null)),
                List.of(new Prototype("l", shared, Label.LEGIT, null, null)));
        ByteSequence subject = ByteSequence.utf8("html body form input");

        ClassificationResult r = engine(store).classify(subject, DetectionMode.RESOURCE_SIGNATURE);

        assertEquals(r.phish_min(), r.legit_min());
        assertTrue(r.minimal_dom_adjustment_applied());
        assertEquals(r.legit_min() + 0.05, r.legit_min_adjusted(), 1e-12);
        assertTrue(r.legit_min_adjusted() > r.phish_min());
        assertEquals(Verdict.PHISH, r.verdict());
        assertEquals(DecisionSource.PROTOTYPE, r.source());
        assertNull(r.best_cluster());
        assertEquals(DetectionMode.RESOURCE_SIGNATURE, r.detection_mode());
    }

    @Test
    void penaltyOnlyBelowThreshold() {
        DecisionEngine engine = engine(clustered);

        ClassificationResult small = engine.decide(bundle(0.5, 0.4, 299), clustered, DetectionMode.DOM_STRUCTURE, MlSignal.disabled());
        ClassificationResult large = engine.decide(bundle(0.5, 0.4, 300), clustered, DetectionMode.DOM_STRUCTURE, MlSignal.disabled());

        assertTrue(small.minimal_dom_adjustment_applied());
        assertEquals(0.45, small.legit_min_adjusted(), 1e-12);
        assertEquals(0.45, small.legit_avg_adjusted(), 1e-12);
        assertFalse(large.minimal_dom_adjustment_applied());
        assertEquals(0.4, large.legit_min_adjusted());
        assertEquals(0.4, large.legit_min());
    }

    @Test
    void tiesGoToLegitWithoutPenalty() {
        ClassificationResult r = engine(clustered).decide(bundle(0.4, 0.4, 5000), clustered,
                DetectionMode.DOM_STRUCTURE, MlSignal.disabled());

        assertEquals(Verdict.LEGIT, r.verdict());
        assertEquals(Confidence.LOW, r.confidence());
    }

    @Test
    void confidenceFollowsSeparation() {
        DecisionEngine engine = engine(clustered);

        assertEquals(Confidence.HIGH, engine.decide(bundle(0.2, 0.5, 5000), clustered, null, MlSignal.disabled()).confidence());
        assertEquals(Confidence.MEDIUM, engine.decide(bundle(0.43, 0.5, 5000), clustered, null, MlSignal.disabled()).confidence());
        assertEquals(Confidence.LOW, engine.decide(bundle(0.48, 0.5, 5000), clustered, null, MlSignal.disabled()).confidence());
        assertEquals(Confidence.MEDIUM, engine.confidenceFor(0.10));
        assertEquals(Confidence.LOW, engine.confidenceFor(0.05));
    }

    @Test
    void confidentMlPredictionOverridesNcd() {
        ClassificationResult r = engine(clustered).decide(bundle(0.6, 0.3, 5000), clustered,
                DetectionMode.DOM_STRUCTURE, MlSignal.ok(Label.PHISH, 0.9));

        assertEquals(Verdict.LEGIT, r.ncd_verdict());
        assertEquals(Verdict.PHISH, r.verdict());
        assertEquals(DecisionSource.ML, r.decision_source());
        assertEquals(DecisionSource.NCD_CLUSTERED, r.source());
        assertEquals(0.9, r.ml_prediction().probability());
    }

    @Test
    void mlAtThresholdDecidesBelowDoesNot() {
        DecisionEngine engine = engine(clustered);

        ClassificationResult at = engine.decide(bundle(0.2, 0.6, 5000), clustered, null, MlSignal.ok(Label.LEGIT, 0.6));
        ClassificationResult below = engine.decide(bundle(0.2, 0.6, 5000), clustered, null, MlSignal.ok(Label.LEGIT, 0.59));

        assertEquals(Verdict.LEGIT, at.verdict());
        assertEquals(DecisionSource.ML, at.decision_source());
        assertEquals(Verdict.PHISH, below.verdict());
        assertEquals(DecisionSource.NCD_CLUSTERED, below.decision_source());
        assertNotNull(below.ml_prediction());
    }

    @Test
    void mlFailureFallsBackToNcd() {
        ClassificationResult r = engine(clustered).decide(bundle(0.2, 0.6, 5000), clustered,
                DetectionMode.DOM_STRUCTURE, MlSignal.failed("connection refused"));

        assertEquals(Verdict.PHISH, r.verdict());
        assertEquals(DecisionSource.NCD_FALLBACK, r.decision_source());
        assertTrue(r.reason().contains("connection refused"));
        assertNull(r.ml_prediction());
    }

    @Test
    void mlCanDecideWhenPrototypesAreMissing() {
        PrototypeStore empty = PrototypeStore.empty(ScoringStrategy.FLAT);
        DecisionEngine engine = engine(empty);

        ClassificationResult r = engine.decide(engine.score(ByteSequence.utf8(LOGIN)), empty,
                DetectionMode.DOM_STRUCTURE, MlSignal.ok(Label.PHISH, 0.95));

        assertEquals(Verdict.UNKNOWN, r.ncd_verdict());
        assertEquals(Verdict.PHISH, r.verdict());
        assertEquals(DecisionSource.ML, r.decision_source());
    }

    @Test
    void emptySubjectIsMaximallyDistant() {
        ScoreBundle scores = engine(clustered).score(ByteSequence.empty());

        assertEquals(1.0, scores.phishMin());
        assertEquals(1.0, scores.legitMin());
        assertEquals(0, scores.subjectSize());
        assertTrue(scores.phishAvailable());

        ClassificationResult r = engine(clustered).decide(scores, clustered, DetectionMode.DOM_STRUCTURE, MlSignal.disabled());
        assertTrue(r.minimal_dom_adjustment_applied());
        assertEquals(Verdict.PHISH, r.verdict());
    }

    @Test
    void loweringPhishDistanceCrossesTheBoundaryOnce() {
        DecisionEngine engine = engine(clustered);
        Verdict previous = null;
        int flips = 0;
        for (int i = 100; i >= 0; i--) {
            double phishMin = i / 100.0;
            Verdict v = engine.decide(bundle(phishMin, 0.45, 5000), clustered, null, MlSignal.disabled()).verdict();
            if (previous != null && v != previous) flips++;
            if (previous == Verdict.PHISH) assertEquals(Verdict.PHISH, v);
            previous = v;
        }
        assertEquals(1, flips);
    }

    private static ScoreBundle bundle(double phishMin, double legitMin, int size) {
        return new ScoreBundle(phishMin, phishMin, legitMin, legitMin,
                List.of(new ClusterScore(1, phishMin, phishMin, 1)), 1, true, true, size);
    }

    private static Prototype proto(String id, String content, Label label, Integer cluster) {
        return new Prototype(id, ByteSequence.utf8(content), label, cluster, null);
    }
}
