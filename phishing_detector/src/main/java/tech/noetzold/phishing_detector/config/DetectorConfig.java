package tech.noetzold.phishing_detector.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tech.noetzold.phishing_detector.clustering.FarthestPointFirst;
import tech.noetzold.phishing_detector.model.ScoringStrategy;
import tech.noetzold.phishing_detector.ncd.CompressionOracle;
import tech.noetzold.phishing_detector.ncd.NcdMetric;
import tech.noetzold.phishing_detector.page.DomSanitizer;
import tech.noetzold.phishing_detector.page.FeatureExtractor;
import tech.noetzold.phishing_detector.page.ResourceSignatureExtractor;
import tech.noetzold.phishing_detector.page.SanitizeMode;

import java.nio.file.Path;
import java.util.Random;

@Slf4j
@Configuration
public class DetectorConfig {

    @Bean
    public ScoringStrategy scoringStrategy(@Value("${detector.scoring.strategy:clustered}") String strategy) {
        ScoringStrategy s = ScoringStrategy.fromConfig(strategy);
        log.info("Scoring strategy: {}", s.source().tag());
        return s;
    }

    @Bean
    public DecisionSettings decisionSettings(
            @Value("${detector.minimal-dom.threshold:300}") int minimalDomThreshold,
            @Value("${detector.minimal-dom.penalty:0.05}") double minimalDomPenalty,
            @Value("${detector.confidence.high-separation:0.10}") double highSeparation,
            @Value("${detector.confidence.low-separation:0.05}") double lowSeparation,
            @Value("${detector.ml.confidence-threshold:0.6}") double mlConfidenceThreshold,
            @Value("${detector.small-dom-threshold:2000}") int smallDomThreshold) {
        return new DecisionSettings(minimalDomThreshold, minimalDomPenalty, highSeparation,
                lowSeparation, mlConfidenceThreshold, smallDomThreshold);
    }

    @Bean
    public ClusteringSettings clusteringSettings(
            @Value("${detector.clustering.samples-dir:samples}") Path samplesDir,
            @Value("${detector.prototypes.dir:prototypes}") Path outputDir,
            @Value("${detector.clustering.prototypes-per-class:5}") int prototypesPerClass,
            @Value("${detector.clustering.max-clusters:4}") int maxClusters,
            @Value("${detector.clustering.min-clusters:2}") int minClusters,
            @Value("${detector.clustering.variance-epsilon:0.001}") double varianceEpsilon,
            @Value("${detector.clustering.parallel-matrix:false}") boolean parallelMatrix) {
        return new ClusteringSettings(samplesDir, outputDir, prototypesPerClass, maxClusters,
                minClusters, varianceEpsilon, parallelMatrix);
    }

    @Bean
    public CompressionOracle compressionOracle(
            @Value("${detector.compression.preset:6}") int preset,
            @Value("${detector.compression.cache-size:10000}") long cacheSize) {
        return new CompressionOracle(preset, cacheSize);
    }

    @Bean
    public NcdMetric ncdMetric(CompressionOracle compressionOracle) {
        return new NcdMetric(compressionOracle);
    }

    @Bean
    public FarthestPointFirst farthestPointFirst() {
        return new FarthestPointFirst(new Random());
    }

    @Bean
    public DomSanitizer domSanitizer(@Value("${detector.sanitize.mode:tags_only}") String mode) {
        return new DomSanitizer(SanitizeMode.fromConfig(mode));
    }

    @Bean
    public ResourceSignatureExtractor resourceSignatureExtractor() {
        return new ResourceSignatureExtractor();
    }

    @Bean
    public FeatureExtractor featureExtractor() {
        return new FeatureExtractor();
    }
}
