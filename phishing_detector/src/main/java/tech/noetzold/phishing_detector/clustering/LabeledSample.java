package tech.noetzold.phishing_detector.clustering;

import tech.noetzold.phishing_detector.model.ByteSequence;
import tech.noetzold.phishing_detector.model.Label;

public record LabeledSample(
        String name,
        ByteSequence content,
        Label label,
        String url
) {}
