package tech.noetzold.phishing_detector.page;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import tech.noetzold.phishing_detector.model.ClusterScore;
import tech.noetzold.phishing_detector.model.ScoreBundle;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattens a page into the numeric feature vector the ML model was trained on. Key order is
 * stable; NCD features come from the scores already computed for the request.
 */
public class FeatureExtractor {

    static final int NCD_CLUSTERS = 3;

    private static final List<String> COUNTED = List.of("form", "input", "script", "img", "iframe", "link", "meta");

    public Map<String, Double> extract(String html, ScoreBundle scores) {
        Map<String, Double> features = new LinkedHashMap<>();
        tagFeatures(html, features);
        ncdFeatures(scores, features);
        return features;
    }

    private void tagFeatures(String html, Map<String, Double> out) {
        List<String> tags = new ArrayList<>();
        int depth = 0;
        double avgChildren = 0.0;

        if (html != null && !html.isBlank()) {
            Document doc = Jsoup.parse(html);
            int parents = 0;
            int children = 0;
            for (Element el : doc.getAllElements()) {
                if (el == doc) continue;
                tags.add(el.tagName());
                int n = el.childrenSize();
                if (n > 0) {
                    parents++;
                    children += n;
                }
            }
            depth = depth(doc, 0);
            avgChildren = parents == 0 ? 0.0 : (double) children / parents;
        }

        Map<String, Integer> counts = new HashMap<>();
        for (String t : tags) counts.merge(t, 1, Integer::sum);

        out.put("total_tag_count", (double) tags.size());
        out.put("unique_tag_count", (double) new HashSet<>(tags).size());
        out.put("depth_of_dom_tree", (double) depth);
        out.put("average_children_per_node", avgChildren);
        for (String tag : COUNTED) {
            out.put("count_" + tag, (double) counts.getOrDefault(tag, 0));
        }

        String sequence = String.join(" ", tags);
        out.put("dom_entropy", shannonEntropy(sequence));
        out.put("dom_token_count", (double) tags.size());
        out.put("dom_length_bytes", html == null ? 0.0 : (double) html.getBytes(StandardCharsets.UTF_8).length);
        int interactive = counts.getOrDefault("form", 0) + counts.getOrDefault("input", 0)
                + counts.getOrDefault("button", 0);
        out.put("ratio_interactive_tags", tags.isEmpty() ? 0.0 : (double) interactive / tags.size());
    }

    private void ncdFeatures(ScoreBundle scores, Map<String, Double> out) {
        Map<Integer, ClusterScore> byId = new HashMap<>();
        if (scores != null) {
            for (ClusterScore c : scores.clusters()) byId.put(c.cluster(), c);
        }

        double best = ScoreBundle.MAX_DISTANCE;
        double avgSum = 0.0;
        for (int id = 1; id <= NCD_CLUSTERS; id++) {
            ClusterScore c = byId.get(id);
            double min = c == null ? ScoreBundle.MAX_DISTANCE : c.min();
            double avg = c == null ? ScoreBundle.MAX_DISTANCE : c.avg();
            out.put("ncd_phish_cluster_" + id + "_min", min);
            out.put("ncd_phish_cluster_" + id + "_avg", avg);
            best = Math.min(best, min);
            avgSum += avg;
        }

        boolean legit = scores != null && scores.legitAvailable();
        out.put("ncd_legit_min", legit ? scores.legitMin() : ScoreBundle.MAX_DISTANCE);
        out.put("ncd_legit_avg", legit ? scores.legitAvg() : ScoreBundle.MAX_DISTANCE);
        out.put("ncd_phish_best", best);
        out.put("ncd_phish_avg", avgSum / NCD_CLUSTERS);
    }

    private static int depth(Element node, int current) {
        int max = current;
        for (Element child : node.children()) {
            max = Math.max(max, depth(child, current + 1));
        }
        return max;
    }

    static double shannonEntropy(String sequence) {
        if (sequence.isEmpty()) return 0.0;
        Map<Character, Integer> freq = new HashMap<>();
        for (int i = 0; i < sequence.length(); i++) {
            freq.merge(sequence.charAt(i), 1, Integer::sum);
        }
        double entropy = 0.0;
        double n = sequence.length();
        for (int count : freq.values()) {
            double p = count / n;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }
}
