package tech.noetzold.phishing_detector.page;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import tech.noetzold.phishing_detector.model.ByteSequence;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces rendered HTML to its structural skeleton: the element-name stream in document
 * order, with text, scripts, styles and noscript blocks dropped.
 */
public class DomSanitizer {

    private static final String STRIPPED = "script, style, noscript";

    private final SanitizeMode mode;

    public DomSanitizer(SanitizeMode mode) {
        this.mode = mode;
    }

    public SanitizeMode mode() {
        return mode;
    }

    public ByteSequence sanitize(String html) {
        if (html == null || html.isBlank()) {
            return ByteSequence.empty();
        }
        return ByteSequence.utf8(String.join(" ", tokens(html)));
    }

    List<String> tokens(String html) {
        Document doc = Jsoup.parse(html);
        doc.select(STRIPPED).remove();

        List<String> out = new ArrayList<>();
        for (Element el : doc.getAllElements()) {
            if (el == doc) continue;
            if (mode == SanitizeMode.TAGS_ATTRS && el.attributesSize() > 0) {
                for (Attribute attr : el.attributes()) {
                    out.add(el.tagName() + ":" + attr.getKey());
                }
            } else {
                out.add(el.tagName());
            }
        }
        return out;
    }
}
