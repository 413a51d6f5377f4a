package tech.noetzold.phishing_detector.clustering;

import tech.noetzold.phishing_detector.model.Label;

import java.nio.file.Path;
import java.util.List;

public record PrototypeBuildReport(
        Label label,
        int samples,
        int requested,
        List<String> selectedSamples,
        List<Path> files
) {}
