package tech.noetzold.phishing_detector.page;

public enum SanitizeMode {
    TAGS_ONLY,
    TAGS_ATTRS;

    public static SanitizeMode fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return TAGS_ONLY;
        }
        return switch (value.trim().toLowerCase().replace('-', '_')) {
            case "tags_only" -> TAGS_ONLY;
            case "tags_attrs" -> TAGS_ATTRS;
            default -> throw new IllegalArgumentException("Unknown sanitize mode: " + value);
        };
    }
}
