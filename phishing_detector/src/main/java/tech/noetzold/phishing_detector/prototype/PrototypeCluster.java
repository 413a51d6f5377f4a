package tech.noetzold.phishing_detector.prototype;

import java.util.List;

public record PrototypeCluster(int id, List<Prototype> members) {

    public PrototypeCluster {
        members = List.copyOf(members);
    }

    public int size() {
        return members.size();
    }
}
