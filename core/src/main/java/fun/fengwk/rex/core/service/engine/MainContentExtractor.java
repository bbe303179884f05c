package fun.fengwk.rex.core.service.engine;

import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Picks the main content of a page and turns it into an {@link ExtractedDocument}.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class MainContentExtractor {

    static final int MAX_LINKS = 200;
    static final int MAX_MEDIA = 50;
    static final int WORDS_PER_MINUTE = 200;

    private static final int MIN_MAIN_TEXT_LENGTH = 120;

    private static final String NON_CONTENT_TAGS = "script, style, noscript, template, iframe, form, svg, button";

    private static final List<String> CHROME_SELECTORS = List.of(
        "header",
        "footer",
        "nav",
        "aside",
        "[role=navigation]",
        "[role=banner]",
        "[role=contentinfo]",
        ".navbar",
        ".sidebar",
        "#sidebar",
        ".menu",
        ".breadcrumbs",
        ".cookie",
        "#cookie",
        ".modal",
        ".popup",
        ".ad",
        ".ads",
        ".advert",
        ".share",
        ".social",
        ".related",
        ".comments",
        "#comments",
        ".toc",
        "#toc"
    );

    private static final List<String> MAIN_CANDIDATE_SELECTORS = List.of(
        "article",
        "main",
        "[role=main]",
        "#main",
        "#main-content",
        "#content",
        ".main-content",
        ".content",
        ".article-content",
        ".post-content",
        ".entry-content",
        "#mw-content-text"
    );

    private final MarkdownRenderer markdownRenderer;

    public Document parse(String html, String url) {
        return Jsoup.parse(html == null ? "" : html, url == null ? "" : url);
    }

    public ExtractedDocument extract(String html, String url) {
        return extract(parse(html, url), url);
    }

    /**
     * Reads page metadata, strips page chrome and renders the best scoring content container.
     * The given document is modified.
     */
    public ExtractedDocument extract(Document document, String url) {
        String title = firstNonBlank(
            metaContent(document, "meta[property=og:title]"),
            document.title(),
            textOf(document.selectFirst("h1"))
        );
        String byline = firstNonBlank(
            metaContent(document, "meta[name=author]"),
            metaContent(document, "meta[property=article:author]"),
            textOf(document.selectFirst("[rel=author], [itemprop=author], .byline, .author"))
        );
        String published = firstNonBlank(
            metaContent(document, "meta[property=article:published_time]"),
            metaContent(document, "meta[itemprop=datePublished]"),
            metaContent(document, "meta[name=date]"),
            attrOf(document.selectFirst("time[datetime]"), "datetime")
        );
        String description = firstNonBlank(
            metaContent(document, "meta[name=description]"),
            metaContent(document, "meta[property=og:description]")
        );
        String siteName = metaContent(document, "meta[property=og:site_name]");
        String language = firstNonBlank(
            attrOf(document.selectFirst("html[lang]"), "lang"),
            metaContent(document, "meta[http-equiv=content-language]")
        );

        document.select(NON_CONTENT_TAGS).remove();
        for (String selector : CHROME_SELECTORS) {
            document.select(selector).remove();
        }

        Element body = document.body();
        Element main = body == null ? null : selectMainContent(document, body);
        String text = main == null ? "" : normalizeWhitespace(main.text());
        String markdown = "";
        if (main != null) {
            markdown = markdownRenderer.render(main == body ? body.html() : main.outerHtml());
        }
        int wordCount = countWords(text);

        return ExtractedDocument.builder()
            .url(url)
            .title(title)
            .byline(byline)
            .publishedIso(published)
            .description(description)
            .siteName(siteName)
            .language(language)
            .text(text)
            .markdown(markdown)
            .links(main == null ? new ArrayList<>() : collectLinks(main))
            .media(main == null ? new ArrayList<>() : collectMedia(main))
            .wordCount(wordCount)
            .readingTime(readingTimeOf(wordCount))
            .build();
    }

    static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }

    static int readingTimeOf(int wordCount) {
        if (wordCount <= 0) {
            return 0;
        }
        return (wordCount + WORDS_PER_MINUTE - 1) / WORDS_PER_MINUTE;
    }

    private Element selectMainContent(Document document, Element body) {
        Set<Element> candidates = new LinkedHashSet<>();
        for (String selector : MAIN_CANDIDATE_SELECTORS) {
            candidates.addAll(document.select(selector));
        }
        if (candidates.isEmpty()) {
            candidates.addAll(body.select("section, div"));
        }

        Element best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Element candidate : candidates) {
            double score = scoreCandidate(candidate);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }
        if (best == null) {
            return body;
        }

        int bodyTextLength = normalizeWhitespace(body.text()).length();
        int minimumTextLength = Math.min(MIN_MAIN_TEXT_LENGTH, Math.max(40, bodyTextLength / 8));
        if (normalizeWhitespace(best.text()).length() < minimumTextLength) {
            return body;
        }
        return best;
    }

    private double scoreCandidate(Element candidate) {
        int textLength = normalizeWhitespace(candidate.text()).length();
        if (textLength == 0) {
            return Double.NEGATIVE_INFINITY;
        }
        int linkTextLength = 0;
        for (Element link : candidate.select("a")) {
            linkTextLength += normalizeWhitespace(link.text()).length();
        }
        double linkDensity = linkTextLength / (double) textLength;
        int blockCount = candidate.select("p, h1, h2, h3, h4, li, pre, blockquote, table").size();
        double markupOverhead = candidate.outerHtml().length() / (double) textLength;

        double score = textLength * (1D - Math.min(0.95D, linkDensity));
        score += Math.min(80, blockCount) * 12D;
        score -= Math.min(240D, markupOverhead * 18D);
        String marker = (candidate.tagName() + " " + candidate.id() + " " + candidate.className()).toLowerCase(Locale.ROOT);
        if (marker.contains("article") || marker.contains("main") || marker.contains("content") || marker.contains("post")) {
            score += 120D;
        }
        if (marker.contains("comment") || marker.contains("sidebar") || marker.contains("footer") || marker.contains("nav")) {
            score *= 0.3D;
        }
        return score;
    }

    private List<String> collectLinks(Element root) {
        Set<String> links = new LinkedHashSet<>();
        for (Element element : root.select("a[href]")) {
            String href = element.attr("abs:href");
            if (isHttpUrl(href)) {
                links.add(href);
                if (links.size() >= MAX_LINKS) {
                    break;
                }
            }
        }
        return new ArrayList<>(links);
    }

    private List<String> collectMedia(Element root) {
        Set<String> media = new LinkedHashSet<>();
        for (Element element : root.select("img[src], video[src], video source[src], audio[src], audio source[src]")) {
            String src = element.attr("abs:src");
            if (isHttpUrl(src)) {
                media.add(src);
                if (media.size() >= MAX_MEDIA) {
                    break;
                }
            }
        }
        return new ArrayList<>(media);
    }

    private boolean isHttpUrl(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        String lower = value.toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    private String metaContent(Document document, String selector) {
        return attrOf(document.selectFirst(selector), "content");
    }

    private String attrOf(Element element, String attribute) {
        return element == null ? "" : element.attr(attribute).trim();
    }

    private String textOf(Element element) {
        return element == null ? "" : normalizeWhitespace(element.text());
    }

    private String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return "";
    }

    private static String normalizeWhitespace(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        return value.replaceAll("\\s+", " ").trim();
    }

}
