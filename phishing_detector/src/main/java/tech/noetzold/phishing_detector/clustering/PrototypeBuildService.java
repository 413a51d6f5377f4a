package tech.noetzold.phishing_detector.clustering;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tech.noetzold.phishing_detector.config.ClusteringSettings;
import tech.noetzold.phishing_detector.model.ByteSequence;
import tech.noetzold.phishing_detector.model.Label;
import tech.noetzold.phishing_detector.ncd.NcdMetric;
import tech.noetzold.phishing_detector.prototype.PrototypeLayout;
import tech.noetzold.phishing_detector.prototype.PrototypeWriter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Offline prototype construction: per-class FPF subset selection and FPF clustering of the
 * phishing pool. Single-threaded apart from the optional parallel distance matrix.
 */
@Slf4j
@Service
public class PrototypeBuildService {

    private final SampleLoader sampleLoader;
    private final PrototypeWriter writer;
    private final NcdMetric metric;
    private final FarthestPointFirst fpf;
    private final ClusteringSettings settings;

    public PrototypeBuildService(SampleLoader sampleLoader,
                                 PrototypeWriter writer,
                                 NcdMetric metric,
                                 FarthestPointFirst fpf,
                                 ClusteringSettings settings) {
        this.sampleLoader = sampleLoader;
        this.writer = writer;
        this.metric = metric;
        this.fpf = fpf;
        this.settings = settings;
    }

    public Map<Label, PrototypeBuildReport> buildPrototypes() {
        return buildPrototypes(settings.samplesDir(), settings.prototypesPerClass(), settings.outputDir());
    }

    public Map<Label, PrototypeBuildReport> buildPrototypes(Path samplesDir, int k, Path outputDir) {
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, got " + k);
        }
        log.info("Building prototypes: samples={}, k={}, output={}", samplesDir, k, outputDir);

        Map<Label, List<LabeledSample>> pools = sampleLoader.loadByLabel(samplesDir);
        Map<Label, PrototypeBuildReport> reports = new EnumMap<>(Label.class);

        for (Label label : Label.values()) {
            List<LabeledSample> pool = pools.get(label);
            Path folder = PrototypeLayout.classDir(outputDir, label);
            writer.clear(folder);
            if (pool.isEmpty()) {
                log.warn("No {} samples; skipping", label.tag());
                reports.put(label, new PrototypeBuildReport(label, 0, k, List.of(), List.of()));
                continue;
            }

            DistanceMatrix matrix = DistanceMatrix.compute(contents(pool), metric, settings.parallelMatrix());
            List<Integer> picked = fpf.select(matrix, k, SeedPolicy.RANDOM);
            List<LabeledSample> selected = picked.stream().map(pool::get).toList();

            List<Path> files = writer.write(selected, label, folder, label == Label.PHISH ? 1 : null);
            List<String> names = selected.stream().map(LabeledSample::name).toList();

            log.info("{} prototypes: {}/{} selected from {} samples: {}",
                    label.tag(), files.size(), k, pool.size(), names);
            reports.put(label, new PrototypeBuildReport(label, pool.size(), k, names, files));
        }
        return reports;
    }

    public List<ClusterReport> clusterPhishing() {
        return clusterPhishing(settings.samplesDir(), settings.outputDir());
    }

    public List<ClusterReport> clusterPhishing(Path samplesDir, Path outputDir) {
        List<LabeledSample> pool = sampleLoader.loadByLabel(samplesDir).get(Label.PHISH);
        if (pool.size() < settings.minClusters()) {
            throw new IllegalStateException("Need at least " + settings.minClusters()
                    + " phishing samples for clustering, found " + pool.size());
        }

        DistanceMatrix matrix = DistanceMatrix.compute(contents(pool), metric, settings.parallelMatrix());
        ClusteringResult result = fpf.cluster(matrix, settings.maxClusters(), settings.minClusters(),
                settings.varianceEpsilon());

        writer.clear(outputDir.resolve(PrototypeLayout.CLUSTERED_DIR));

        List<ClusterReport> reports = new ArrayList<>();
        for (int c = 0; c < result.clusterCount(); c++) {
            int clusterId = c + 1;
            List<Integer> members = result.members(c);
            List<LabeledSample> samples = members.stream().map(pool::get).toList();
            Path folder = PrototypeLayout.clusterDir(outputDir, clusterId);
            writer.write(samples, Label.PHISH, folder, clusterId);

            ClusterReport report = describe(clusterId, result.centers().get(c), members, pool, matrix, folder);
            logReport(report, members, result.centers().get(c), pool, matrix);
            reports.add(report);
        }
        log.info("Clustering complete: {} clusters over {} samples -> {}",
                reports.size(), pool.size(), outputDir.resolve(PrototypeLayout.CLUSTERED_DIR));
        return reports;
    }

    private ClusterReport describe(int clusterId, int center, List<Integer> members,
                                   List<LabeledSample> pool, DistanceMatrix matrix, Path folder) {
        double min = Double.NaN;
        double max = Double.NaN;
        double sum = 0.0;
        int pairs = 0;
        for (int a = 0; a < members.size(); a++) {
            for (int b = a + 1; b < members.size(); b++) {
                double d = matrix.get(members.get(a), members.get(b));
                min = pairs == 0 ? d : Math.min(min, d);
                max = pairs == 0 ? d : Math.max(max, d);
                sum += d;
                pairs++;
            }
        }
        double avg = pairs == 0 ? Double.NaN : sum / pairs;
        List<String> names = members.stream().map(i -> pool.get(i).name()).toList();
        return new ClusterReport(clusterId, pool.get(center).name(), names, min, max, avg, folder);
    }

    private void logReport(ClusterReport r, List<Integer> members, int center,
                           List<LabeledSample> pool, DistanceMatrix matrix) {
        log.info("Cluster {}: center={}, size={}", r.cluster(), r.center(), r.members().size());
        if (!Double.isNaN(r.intraAvg())) {
            log.info("  intra-cluster distance min={} max={} avg={}",
                    String.format("%.4f", r.intraMin()), String.format("%.4f", r.intraMax()),
                    String.format("%.4f", r.intraAvg()));
        }
        for (int i : members) {
            log.debug("  - {} (dist to center {})", pool.get(i).name(), String.format("%.4f", matrix.get(i, center)));
        }
    }

    private static List<ByteSequence> contents(List<LabeledSample> pool) {
        return pool.stream().map(LabeledSample::content).toList();
    }
}
