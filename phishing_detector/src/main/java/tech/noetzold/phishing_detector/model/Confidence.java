package tech.noetzold.phishing_detector.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Confidence {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String tag;

    Confidence(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
