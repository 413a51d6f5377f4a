package tech.noetzold.phishing_detector.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which policy produced a verdict. {@link #NCD_FALLBACK} marks an NCD verdict that
 * stands only because the ML predictor failed.
 */
public enum DecisionSource {
    PROTOTYPE("prototype"),
    NCD_CLUSTERED("ncd-clustered"),
    ML("ml"),
    NCD_FALLBACK("ncd-fallback");

    private final String tag;

    DecisionSource(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
