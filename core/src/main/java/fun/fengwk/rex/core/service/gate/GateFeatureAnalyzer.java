package fun.fengwk.rex.core.service.gate;

import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Scans raw html and produces sanitized {@link GateFeatures}.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class GateFeatureAnalyzer {

    private static final int FRAMEWORK_ROOT_MIN_DIVS = 20;
    private static final int SPA_MIN_VISIBLE_CHARS = 200;

    private static final List<String> FRAMEWORK_ROOT_SELECTORS = List.of("div#root", "div#app", "div#__next");

    private static final Pattern JSON_LD_ARTICLE = Pattern.compile(
        "\"@type\"\\s*:\\s*\\[?[^\\]]*?\"(Article|NewsArticle|BlogPosting)\"",
        Pattern.CASE_INSENSITIVE
    );

    private static final Pattern ENABLE_JAVASCRIPT = Pattern.compile(
        "(enable|turn on)\\s+javascript|javascript\\s+(is\\s+)?(required|disabled)",
        Pattern.CASE_INSENSITIVE
    );

    private final DomainPriorProvider domainPriorProvider;

    public GateFeatures analyze(byte[] content, String url) {
        if (content == null || content.length == 0) {
            return analyze("", url);
        }
        return analyze(new String(content, StandardCharsets.UTF_8), url);
    }

    public GateFeatures analyze(String html, String url) {
        String safeHtml = html == null ? "" : html;
        Document document = Jsoup.parse(safeHtml, url == null ? "" : url);

        long htmlBytes = safeHtml.getBytes(StandardCharsets.UTF_8).length;
        long scriptBytes = 0L;
        boolean hasJsonLdArticle = false;
        boolean hasHydration = false;
        for (Element script : document.select("script")) {
            String data = script.data();
            scriptBytes += data.getBytes(StandardCharsets.UTF_8).length;
            if ("application/ld+json".equalsIgnoreCase(script.attr("type")) && JSON_LD_ARTICLE.matcher(data).find()) {
                hasJsonLdArticle = true;
            }
            if ("__NEXT_DATA__".equals(script.id()) || data.contains("window.__NUXT__") || data.contains("__NEXT_DATA__")) {
                hasHydration = true;
            }
        }
        if (document.selectFirst("[data-reactroot], [data-server-rendered], #__nuxt") != null) {
            hasHydration = true;
        }

        boolean noscriptNotice = false;
        for (Element noscript : document.select("noscript")) {
            if (ENABLE_JAVASCRIPT.matcher(noscript.text()).find() || ENABLE_JAVASCRIPT.matcher(noscript.html()).find()) {
                noscriptNotice = true;
                break;
            }
        }

        boolean hasOpenGraphTitle = false;
        Element ogTitle = document.selectFirst("meta[property=og:title]");
        if (ogTitle != null && !ogTitle.attr("content").isBlank()) {
            hasOpenGraphTitle = true;
        }

        int paragraphCount = document.select("p").size();
        int articleTagCount = document.select("article, main").size();
        int headingCount = document.select("h1, h2").size();

        document.select("script, style, noscript, template").remove();
        Element body = document.body();
        long visibleTextChars = body == null ? 0L : body.text().length();

        Element frameworkRoot = findFrameworkRoot(document);
        int flags = 0;
        if (hasHydration) {
            flags |= SpaMarker.HYDRATION.getBit();
        }
        if (frameworkRoot != null
            && (frameworkRoot.select("div").size() > FRAMEWORK_ROOT_MIN_DIVS || visibleTextChars < SPA_MIN_VISIBLE_CHARS)) {
            flags |= SpaMarker.FRAMEWORK_ROOT.getBit();
        }
        if (htmlBytes > 0 && scriptBytes * 2 > htmlBytes) {
            flags |= SpaMarker.OVERSIZED_BUNDLE.getBit();
        }
        if (noscriptNotice || (frameworkRoot != null && visibleTextChars < SPA_MIN_VISIBLE_CHARS)) {
            flags |= SpaMarker.SPA_ONLY_CONTENT.getBit();
        }

        double domainPrior = domainPriorProvider.priorOf(extractHost(url));
        if (Double.isNaN(domainPrior) || Double.isInfinite(domainPrior)) {
            domainPrior = 0.5D;
        }

        return GateFeatures.builder()
            .htmlBytes(htmlBytes)
            .visibleTextChars(Math.min(visibleTextChars, htmlBytes))
            .paragraphCount(paragraphCount)
            .articleTagCount(articleTagCount)
            .headingCount(headingCount)
            .scriptBytes(Math.min(scriptBytes, htmlBytes))
            .hasOpenGraphTitle(hasOpenGraphTitle)
            .hasJsonLdArticle(hasJsonLdArticle)
            .spaMarkerFlags(flags & 0xFF)
            .domainPrior(Math.max(0D, Math.min(1D, domainPrior)))
            .build();
    }

    private Element findFrameworkRoot(Document document) {
        for (String selector : FRAMEWORK_ROOT_SELECTORS) {
            Element element = document.selectFirst(selector);
            if (element != null) {
                return element;
            }
        }
        return null;
    }

    static String extractHost(String url) {
        if (url == null || url.isBlank()) {
            return "";
        }
        try {
            String host = URI.create(url.trim()).getHost();
            return host == null ? "" : host.toLowerCase(Locale.ROOT);
        } catch (IllegalArgumentException ex) {
            return "";
        }
    }

}
