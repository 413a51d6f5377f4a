package tech.noetzold.phishing_detector.clustering;

import java.nio.file.Path;
import java.util.List;

public record ClusterReport(
        int cluster,
        String center,
        List<String> members,
        double intraMin,
        double intraMax,
        double intraAvg,
        Path folder
) {}
