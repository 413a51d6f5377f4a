package tech.noetzold.phishing_detector.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import tech.noetzold.phishing_detector.clustering.ClusterReport;
import tech.noetzold.phishing_detector.clustering.PrototypeBuildReport;
import tech.noetzold.phishing_detector.clustering.PrototypeBuildService;
import tech.noetzold.phishing_detector.model.ClassificationResult;
import tech.noetzold.phishing_detector.model.Label;
import tech.noetzold.phishing_detector.prototype.PrototypeStore;
import tech.noetzold.phishing_detector.prototype.PrototypeStoreHolder;
import tech.noetzold.phishing_detector.service.DetectionService;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Offline entry points: {@code --build-prototypes}, {@code --cluster-phishing} and
 * {@code --classify=<html-file> [--url=<page-url>]}. Without options only the engine is
 * initialised.
 */
@Slf4j
@Component
public class DetectorCommandRunner implements ApplicationRunner {

    private final PrototypeBuildService builder;
    private final PrototypeStoreHolder stores;
    private final DetectionService detection;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    @Autowired
    public DetectorCommandRunner(PrototypeBuildService builder, PrototypeStoreHolder stores,
                                 DetectionService detection, ObjectMapper objectMapper) {
        this(builder, stores, detection, objectMapper, System.out);
    }

    DetectorCommandRunner(PrototypeBuildService builder, PrototypeStoreHolder stores,
                          DetectionService detection, ObjectMapper objectMapper, PrintStream out) {
        this.builder = builder;
        this.stores = stores;
        this.detection = detection;
        this.objectMapper = objectMapper;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        boolean rebuilt = false;

        if (args.containsOption("build-prototypes")) {
            Map<Label, PrototypeBuildReport> reports = builder.buildPrototypes();
            reports.values().forEach(r -> log.info("Built {} {} prototypes from {} samples",
                    r.files().size(), r.label().tag(), r.samples()));
            rebuilt = true;
        }
        if (args.containsOption("cluster-phishing")) {
            List<ClusterReport> clusters = builder.clusterPhishing();
            log.info("Phishing pool split into {} clusters", clusters.size());
            rebuilt = true;
        }
        if (rebuilt) {
            stores.reload();
        }

        if (args.containsOption("classify")) {
            classify(args);
        } else if (!rebuilt) {
            PrototypeStore store = stores.current();
            log.info("Detector ready: strategy={}, phishing prototypes={}, legitimate prototypes={}",
                    store.strategy().source().tag(), store.phishCount(), store.legitCount());
        }
    }

    private void classify(ApplicationArguments args) throws Exception {
        Path file = Path.of(single(args, "classify"));
        String url = args.containsOption("url") ? single(args, "url") : file.toUri().toString();
        String html = Files.readString(file, StandardCharsets.UTF_8);

        ClassificationResult result = detection.detect(url, html);
        out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new IllegalArgumentException("--" + name + " requires a value");
        }
        return values.get(0);
    }
}
