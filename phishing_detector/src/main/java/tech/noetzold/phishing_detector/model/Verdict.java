package tech.noetzold.phishing_detector.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Verdict {
    PHISH("phish"),
    LEGIT("legit"),
    UNKNOWN("unknown");

    private final String tag;

    Verdict(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    public static Verdict of(Label label) {
        return label == Label.PHISH ? PHISH : LEGIT;
    }
}
