package tech.noetzold.phishing_detector.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DetectionMode {
    DOM_STRUCTURE("dom-structure"),
    RESOURCE_SIGNATURE("resource-signature");

    private final String tag;

    DetectionMode(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
