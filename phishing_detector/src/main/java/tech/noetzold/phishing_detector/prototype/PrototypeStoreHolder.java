package tech.noetzold.phishing_detector.prototype;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tech.noetzold.phishing_detector.model.ScoringStrategy;

import java.util.concurrent.atomic.AtomicReference;

@Slf4j
@Component
public class PrototypeStoreHolder {

    private final PrototypeRepository repository;
    private final ScoringStrategy strategy;
    private final AtomicReference<PrototypeStore> current;

    public PrototypeStoreHolder(PrototypeRepository repository, ScoringStrategy strategy) {
        this.repository = repository;
        this.strategy = strategy;
        this.current = new AtomicReference<>(repository.load(strategy));
    }

    public PrototypeStore current() {
        return current.get();
    }

    public PrototypeStore reload() {
        PrototypeStore fresh = repository.load(strategy);
        PrototypeStore previous = current.getAndSet(fresh);
        log.info("Prototype store swapped: phish {} -> {}, legit {} -> {}",
                previous.phishCount(), fresh.phishCount(), previous.legitCount(), fresh.legitCount());
        return fresh;
    }

    public ScoringStrategy strategy() {
        return strategy;
    }
}
