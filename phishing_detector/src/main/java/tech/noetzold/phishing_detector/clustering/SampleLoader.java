package tech.noetzold.phishing_detector.clustering;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.noetzold.phishing_detector.model.ByteSequence;
import tech.noetzold.phishing_detector.model.Label;
import tech.noetzold.phishing_detector.prototype.PrototypeLayout;
import tech.noetzold.phishing_detector.prototype.PrototypeMetadata;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Reads a labeled sample folder. Samples with an empty {@code .dom}, or without a readable
 * {@code .meta.json} or a label, are skipped with a warning.
 */
@Slf4j
@Component
public class SampleLoader {

    private final ObjectMapper objectMapper;

    public SampleLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Map<Label, List<LabeledSample>> loadByLabel(Path samplesDir) {
        Map<Label, List<LabeledSample>> byLabel = new EnumMap<>(Label.class);
        for (Label l : Label.values()) {
            byLabel.put(l, new ArrayList<>());
        }
        for (LabeledSample s : load(samplesDir)) {
            byLabel.get(s.label()).add(s);
        }
        log.info("Samples in {}: {} phishing, {} legitimate",
                samplesDir, byLabel.get(Label.PHISH).size(), byLabel.get(Label.LEGIT).size());
        return byLabel;
    }

    public List<LabeledSample> load(Path samplesDir) {
        if (!Files.isDirectory(samplesDir)) {
            log.warn("Samples directory not found: {}", samplesDir);
            return List.of();
        }

        List<Path> domFiles;
        try (Stream<Path> s = Files.list(samplesDir)) {
            domFiles = s.filter(p -> p.getFileName().toString().endsWith(PrototypeLayout.DOM_SUFFIX))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list samples in " + samplesDir, e);
        }

        List<LabeledSample> samples = new ArrayList<>();
        for (Path dom : domFiles) {
            Path meta = PrototypeLayout.metaFor(dom);
            if (!Files.exists(meta)) {
                log.warn("Missing metadata for {}", dom.getFileName());
                continue;
            }
            try {
                PrototypeMetadata m = objectMapper.readValue(meta.toFile(), PrototypeMetadata.class);
                if (m == null || m.label() == null) {
                    log.warn("No label in {}", meta.getFileName());
                    continue;
                }
                byte[] bytes = Files.readAllBytes(dom);
                if (bytes.length == 0) {
                    log.warn("Empty sample {}; skipping", dom.getFileName());
                    continue;
                }
                samples.add(new LabeledSample(dom.getFileName().toString(), ByteSequence.of(bytes), m.label(), m.url()));
            } catch (IOException | IllegalArgumentException e) {
                log.error("Failed to load sample {}: {}", dom.getFileName(), e.getMessage());
            }
        }
        log.info("Loaded {} samples from {}", samples.size(), samplesDir);
        return samples;
    }
}
