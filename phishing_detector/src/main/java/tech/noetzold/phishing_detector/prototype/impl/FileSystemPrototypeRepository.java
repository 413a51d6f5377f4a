package tech.noetzold.phishing_detector.prototype.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import tech.noetzold.phishing_detector.model.ByteSequence;
import tech.noetzold.phishing_detector.model.Label;
import tech.noetzold.phishing_detector.model.ScoringStrategy;
import tech.noetzold.phishing_detector.prototype.Prototype;
import tech.noetzold.phishing_detector.prototype.PrototypeCluster;
import tech.noetzold.phishing_detector.prototype.PrototypeLayout;
import tech.noetzold.phishing_detector.prototype.PrototypeMetadata;
import tech.noetzold.phishing_detector.prototype.PrototypeRepository;
import tech.noetzold.phishing_detector.prototype.PrototypeStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

@Slf4j
@Repository
public class FileSystemPrototypeRepository implements PrototypeRepository {

    private final Path root;
    private final ObjectMapper objectMapper;

    public FileSystemPrototypeRepository(@Value("${detector.prototypes.dir:prototypes}") Path root,
                                         ObjectMapper objectMapper) {
        this.root = root;
        this.objectMapper = objectMapper;
    }

    @Override
    public PrototypeStore load(ScoringStrategy strategy) {
        List<Prototype> legit = loadFolder(PrototypeLayout.classDir(root, Label.LEGIT), Label.LEGIT, null);

        PrototypeStore store;
        if (strategy == ScoringStrategy.FLAT) {
            List<Prototype> phish = loadFolder(PrototypeLayout.classDir(root, Label.PHISH), Label.PHISH, 1);
            store = PrototypeStore.flat(phish, legit);
        } else {
            store = PrototypeStore.clustered(loadClusters(), legit);
        }

        log.info("Prototype store loaded from {} ({}): {} phishing in {} cluster(s), {} legitimate",
                root, strategy, store.phishCount(), store.phishClusters().size(), store.legitCount());
        for (PrototypeCluster c : store.phishClusters()) {
            log.info("  phishing cluster {}: {} prototypes", c.id(), c.size());
        }
        if (!store.hasPhish() || !store.hasLegit()) {
            log.warn("Prototype store incomplete (phish={}, legit={}); classifications will report unknown",
                    store.phishCount(), store.legitCount());
        }
        return store;
    }

    private List<PrototypeCluster> loadClusters() {
        Path clusteredRoot = root.resolve(PrototypeLayout.CLUSTERED_DIR);
        if (!Files.isDirectory(clusteredRoot)) {
            log.warn("Clustered prototype folder not found: {}", clusteredRoot);
            return List.of();
        }

        List<PrototypeCluster> clusters = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(clusteredRoot)) {
            List<Integer> ids = dirs.filter(Files::isDirectory)
                    .map(p -> p.getFileName().toString())
                    .filter(n -> n.startsWith(PrototypeLayout.CLUSTER_PREFIX))
                    .map(n -> parseClusterId(n.substring(PrototypeLayout.CLUSTER_PREFIX.length())))
                    .filter(id -> id > 0)
                    .sorted()
                    .toList();
            for (int id : ids) {
                List<Prototype> members = loadFolder(PrototypeLayout.clusterDir(root, id), Label.PHISH, id);
                if (members.isEmpty()) {
                    log.warn("Phishing cluster {} is empty, skipping", id);
                    continue;
                }
                clusters.add(new PrototypeCluster(id, members));
            }
        } catch (IOException e) {
            log.error("Failed to list clustered prototypes in {}", clusteredRoot, e);
        }
        return clusters;
    }

    private List<Prototype> loadFolder(Path folder, Label label, Integer cluster) {
        if (!Files.isDirectory(folder)) {
            log.warn("Prototype folder not found: {}", folder);
            return List.of();
        }

        List<Path> files;
        try (Stream<Path> s = Files.list(folder)) {
            files = s.filter(p -> p.getFileName().toString().endsWith(PrototypeLayout.DOM_SUFFIX))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            log.error("Failed to list prototype folder {}", folder, e);
            return List.of();
        }

        List<Prototype> items = new ArrayList<>();
        for (Path file : files) {
            try {
                byte[] data = Files.readAllBytes(file);
                if (data.length == 0) {
                    log.debug("Skipping empty prototype {}", file);
                    continue;
                }
                String url = readMetadata(file).map(PrototypeMetadata::url).orElse(null);
                items.add(new Prototype(PrototypeLayout.baseName(file), ByteSequence.of(data), label, cluster, url));
            } catch (IOException e) {
                log.error("Failed to load prototype {}: {}", file, e.getMessage());
            }
        }
        log.debug("Loaded {} prototypes from {}", items.size(), folder);
        return items;
    }

    private Optional<PrototypeMetadata> readMetadata(Path domFile) {
        Path meta = PrototypeLayout.metaFor(domFile);
        if (!Files.exists(meta)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(meta.toFile(), PrototypeMetadata.class));
        } catch (IOException e) {
            log.warn("Unreadable metadata {}: {}", meta, e.getMessage());
            return Optional.empty();
        }
    }

    private int parseClusterId(String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            return -1;
        }
    }
}
