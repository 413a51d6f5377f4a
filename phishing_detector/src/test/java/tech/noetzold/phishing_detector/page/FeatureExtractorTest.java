package tech.noetzold.phishing_detector.page;

import org.junit.jupiter.api.Test;
import tech.noetzold.phishing_detector.model.ClusterScore;
import tech.noetzold.phishing_detector.model.ScoreBundle;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FeatureExtractorTest {

    private final FeatureExtractor extractor = new FeatureExtractor();

    private static final String PAGE = "<html><head><meta charset=\"utf-8\"><title>t</title></head>"
            + "<body><form><input><input><button>go</button></form><img></body></html>";

    @Test
    void tagAndStructureFeatures() {
        Map<String, Double> f = extractor.extract(PAGE, null);

        assertEquals(25, f.size());
        assertEquals(10.0, f.get("total_tag_count"));
        assertEquals(9.0, f.get("unique_tag_count"));
        assertEquals(4.0, f.get("depth_of_dom_tree"));
        assertEquals(2.25, f.get("average_children_per_node"), 1e-12);
        assertEquals(1.0, f.get("count_form"));
        assertEquals(2.0, f.get("count_input"));
        assertEquals(0.0, f.get("count_script"));
        assertEquals(1.0, f.get("count_meta"));
        assertEquals(10.0, f.get("dom_token_count"));
        assertEquals(0.4, f.get("ratio_interactive_tags"), 1e-12);
        assertEquals((double) PAGE.length(), f.get("dom_length_bytes"));
        assertTrue(f.get("dom_entropy") > 0.0);
    }

    @Test
    void ncdFeaturesComeFromScores() {
        ScoreBundle scores = new ScoreBundle(0.2, 0.4, 0.6, 0.7,
                List.of(new ClusterScore(1, 0.2, 0.3, 2), new ClusterScore(3, 0.4, 0.5, 1)),
                1, true, true, 4000);

        Map<String, Double> f = extractor.extract(PAGE, scores);

        assertEquals(0.2, f.get("ncd_phish_cluster_1_min"));
        assertEquals(1.0, f.get("ncd_phish_cluster_2_min"));
        assertEquals(0.5, f.get("ncd_phish_cluster_3_avg"));
        assertEquals(0.6, f.get("ncd_legit_min"));
        assertEquals(0.7, f.get("ncd_legit_avg"));
        assertEquals(0.2, f.get("ncd_phish_best"));
        assertEquals(0.6, f.get("ncd_phish_avg"), 1e-12);
    }

    @Test
    void emptyPageDefaults() {
        Map<String, Double> f = extractor.extract("", null);

        assertEquals(25, f.size());
        assertEquals(0.0, f.get("total_tag_count"));
        assertEquals(0.0, f.get("ratio_interactive_tags"));
        assertEquals(1.0, f.get("ncd_legit_min"));
        assertEquals(1.0, f.get("ncd_phish_best"));
    }

    @Test
    void featureOrderIsStable() {
        List<String> keys = List.copyOf(extractor.extract(PAGE, null).keySet());
        assertEquals("total_tag_count", keys.get(0));
        assertEquals("ncd_phish_avg", keys.get(keys.size() - 1));
    }

    @Test
    void entropyOfTwoEquallyLikelySymbolsIsOneBit() {
        assertEquals(1.0, FeatureExtractor.shannonEntropy("aabb"), 1e-12);
        assertEquals(0.0, FeatureExtractor.shannonEntropy(""));
    }
}
