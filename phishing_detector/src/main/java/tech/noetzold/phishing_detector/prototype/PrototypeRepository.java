package tech.noetzold.phishing_detector.prototype;

import tech.noetzold.phishing_detector.model.ScoringStrategy;

public interface PrototypeRepository {
    PrototypeStore load(ScoringStrategy strategy);
}
