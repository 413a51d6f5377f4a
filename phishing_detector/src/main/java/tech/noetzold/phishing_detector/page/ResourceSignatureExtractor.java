package tech.noetzold.phishing_detector.page;

import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import tech.noetzold.phishing_detector.model.ByteSequence;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a structural signature out of the resources a page pulls in. Used instead of the
 * element stream when the DOM is too small to say anything, typically because the content
 * is loaded by script.
 */
@Slf4j
public class ResourceSignatureExtractor {

    private static final Pattern CSS_URL = Pattern.compile("url\\([\"']?([^\"')]+)[\"']?\\)");
    private static final Set<String> HINT_RELS = Set.of("preload", "prefetch", "dns-prefetch", "preconnect");

    public ByteSequence extract(String html, String baseUrl) {
        if (html == null || html.isBlank()) {
            return ByteSequence.empty();
        }
        Document doc = Jsoup.parse(html);
        Set<String> resources = new TreeSet<>();

        for (Element el : doc.select("script[src], img[src], iframe[src], video[src], audio[src], source[src]")) {
            add(resources, el.attr("src"), baseUrl);
        }
        for (Element link : doc.select("link[href]")) {
            String rel = link.attr("rel").toLowerCase(Locale.ROOT);
            for (String token : rel.split("\\s+")) {
                if (token.equals("stylesheet") || HINT_RELS.contains(token)) {
                    add(resources, link.attr("href"), baseUrl);
                    break;
                }
            }
        }
        for (Element style : doc.select("style")) {
            Matcher m = CSS_URL.matcher(style.data());
            while (m.find()) {
                add(resources, m.group(1).trim(), baseUrl);
            }
        }

        String signature = String.join(" ", resources);
        log.info("Resource signature: {} resources, {} bytes", resources.size(), signature.length());
        return ByteSequence.utf8(signature);
    }

    private static void add(Set<String> resources, String url, String baseUrl) {
        String normalized = normalize(url, baseUrl);
        if (!normalized.isEmpty()) {
            resources.add(normalized);
        }
    }

    /**
     * Host without {@code www.} plus path; scheme, query and fragment dropped. Relative
     * references are resolved against {@code baseUrl} when one is given. Inline
     * {@code data:} and {@code blob:} URIs yield an empty string.
     */
    static String normalize(String url, String baseUrl) {
        if (url == null) return "";
        String u = url.trim();
        if (u.isEmpty() || u.startsWith("data:") || u.startsWith("blob:")) {
            return "";
        }
        int cut = indexOfAny(u, '?', '#');
        if (cut >= 0) {
            u = u.substring(0, cut);
        }
        if (u.startsWith("//")) {
            u = "https:" + u;
        }

        URI uri = parse(u);
        if (uri == null) {
            return u;
        }
        if (uri.getScheme() == null && baseUrl != null && !baseUrl.isBlank()) {
            URI base = parse(baseUrl.trim());
            if (base != null && base.isAbsolute()) {
                uri = base.resolve(uri);
            }
        }
        String host = uri.getHost();
        String path = uri.getRawPath() == null ? "" : uri.getRawPath();
        if (host != null) {
            if (host.startsWith("www.")) {
                host = host.substring(4);
            }
            return host + path;
        }
        return path;
    }

    private static URI parse(String value) {
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            log.debug("Unparseable resource URL '{}': {}", value, e.getMessage());
            return null;
        }
    }

    private static int indexOfAny(String s, char a, char b) {
        int i = s.indexOf(a);
        int j = s.indexOf(b);
        if (i < 0) return j;
        if (j < 0) return i;
        return Math.min(i, j);
    }
}
