package tech.noetzold.phishing_detector.model;

/**
 * Outcome of asking the optional ML predictor. Fusion branches on the variant instead of
 * catching exceptions.
 */
public sealed interface MlSignal permits MlSignal.Ok, MlSignal.Unavailable {

    record Ok(MlPrediction prediction) implements MlSignal {}

    /**
     * @param failed true when a configured predictor broke, false when none is configured
     */
    record Unavailable(String reason, boolean failed) implements MlSignal {}

    static MlSignal ok(Label label, double probability) {
        return new Ok(new MlPrediction(label, probability));
    }

    static MlSignal disabled() {
        return new Unavailable("ml predictor not configured", false);
    }

    static MlSignal failed(String reason) {
        return new Unavailable(reason, true);
    }
}
