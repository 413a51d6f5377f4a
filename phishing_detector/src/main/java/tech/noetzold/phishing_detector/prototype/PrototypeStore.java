package tech.noetzold.phishing_detector.prototype;

import tech.noetzold.phishing_detector.model.ScoringStrategy;

import java.util.List;

/**
 * Read-only reference collections used at request time. Built once, then shared across
 * threads without locking. A flat store holds its phishing prototypes as a single cluster.
 */
public record PrototypeStore(
        ScoringStrategy strategy,
        List<PrototypeCluster> phishClusters,
        List<Prototype> legit
) {

    public PrototypeStore {
        phishClusters = phishClusters.stream().filter(c -> c.size() > 0).toList();
        legit = List.copyOf(legit);
    }

    public static PrototypeStore empty(ScoringStrategy strategy) {
        return new PrototypeStore(strategy, List.of(), List.of());
    }

    public static PrototypeStore flat(List<Prototype> phish, List<Prototype> legit) {
        return new PrototypeStore(ScoringStrategy.FLAT, List.of(new PrototypeCluster(1, phish)), legit);
    }

    public static PrototypeStore clustered(List<PrototypeCluster> clusters, List<Prototype> legit) {
        return new PrototypeStore(ScoringStrategy.CLUSTERED, clusters, legit);
    }

    public boolean hasPhish() {
        return !phishClusters.isEmpty();
    }

    public boolean hasLegit() {
        return !legit.isEmpty();
    }

    public int phishCount() {
        return phishClusters.stream().mapToInt(PrototypeCluster::size).sum();
    }

    public int legitCount() {
        return legit.size();
    }
}
