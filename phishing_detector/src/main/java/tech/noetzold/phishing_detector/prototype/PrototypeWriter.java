package tech.noetzold.phishing_detector.prototype;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.noetzold.phishing_detector.clustering.LabeledSample;
import tech.noetzold.phishing_detector.model.Label;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Persists selected samples as prototypes: one {@code .dom} file with the raw bytes and one
 * {@code .meta.json} with label, originating URL and size.
 */
@Slf4j
@Component
public class PrototypeWriter {

    private final ObjectMapper objectMapper;

    public PrototypeWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Path> write(List<LabeledSample> selected, Label label, Path folder, Integer cluster) {
        try {
            Files.createDirectories(folder);
            List<Path> written = new ArrayList<>();
            int ordinal = 1;
            for (LabeledSample sample : selected) {
                String base = PrototypeLayout.prototypeName(label, ordinal++);
                Path dom = folder.resolve(base + PrototypeLayout.DOM_SUFFIX);
                Files.write(dom, sample.content().unsafeBytes());

                PrototypeMetadata meta = new PrototypeMetadata(
                        label, sample.url(), sample.content().length(), cluster, sample.name());
                objectMapper.writerWithDefaultPrettyPrinter()
                        .writeValue(PrototypeLayout.metaFor(dom).toFile(), meta);
                written.add(dom);
            }
            log.info("Wrote {} {} prototypes to {}", written.size(), label.tag(), folder);
            return written;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write prototypes to " + folder, e);
        }
    }

    public void clear(Path folder) {
        if (!Files.exists(folder)) return;
        try (var walk = Files.walk(folder)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path p : paths) {
                Files.delete(p);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clear " + folder, e);
        }
    }
}
