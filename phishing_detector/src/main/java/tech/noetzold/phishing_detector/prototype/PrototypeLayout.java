package tech.noetzold.phishing_detector.prototype;

import tech.noetzold.phishing_detector.model.Label;

import java.nio.file.Path;

public final class PrototypeLayout {

    public static final String PHISHING_DIR = "phishing";
    public static final String LEGITIMATE_DIR = "legitimate";
    public static final String CLUSTERED_DIR = "phishing_clustered";
    public static final String CLUSTER_PREFIX = "cluster_";
    public static final String DOM_SUFFIX = ".dom";
    public static final String META_SUFFIX = ".meta.json";

    private PrototypeLayout() {}

    public static Path classDir(Path root, Label label) {
        return root.resolve(label == Label.PHISH ? PHISHING_DIR : LEGITIMATE_DIR);
    }

    public static Path clusterDir(Path root, int clusterId) {
        return root.resolve(CLUSTERED_DIR).resolve(CLUSTER_PREFIX + clusterId);
    }

    public static String prototypeName(Label label, int ordinal) {
        return String.format("%s_prototype_%02d", label.tag(), ordinal);
    }

    public static Path metaFor(Path domFile) {
        String name = domFile.getFileName().toString();
        String base = name.endsWith(DOM_SUFFIX) ? name.substring(0, name.length() - DOM_SUFFIX.length()) : name;
        return domFile.resolveSibling(base + META_SUFFIX);
    }

    public static String baseName(Path domFile) {
        String name = domFile.getFileName().toString();
        return name.endsWith(DOM_SUFFIX) ? name.substring(0, name.length() - DOM_SUFFIX.length()) : name;
    }
}
