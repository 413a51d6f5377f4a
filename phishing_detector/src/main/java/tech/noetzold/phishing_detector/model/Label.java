package tech.noetzold.phishing_detector.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Label {
    PHISH("phish"),
    LEGIT("legit");

    private final String tag;

    Label(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }

    @JsonCreator
    public static Label fromTag(String value) {
        if (value == null) {
            throw new IllegalArgumentException("label must not be null");
        }
        String v = value.trim().toLowerCase();
        return switch (v) {
            case "phish", "phishing" -> PHISH;
            case "legit", "legitimate" -> LEGIT;
            default -> throw new IllegalArgumentException("Unknown label: " + value);
        };
    }
}
