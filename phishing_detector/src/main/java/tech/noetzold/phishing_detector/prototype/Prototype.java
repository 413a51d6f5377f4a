package tech.noetzold.phishing_detector.prototype;

import tech.noetzold.phishing_detector.model.ByteSequence;
import tech.noetzold.phishing_detector.model.Label;

public record Prototype(
        String id,
        ByteSequence content,
        Label label,
        Integer cluster,
        String url
) {}
