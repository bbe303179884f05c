package fun.fengwk.rex.core.service.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class MainContentExtractorTest {

    private static final String ARTICLE_HTML = """
        <html lang="en">
        <head>
          <title>Fallback title</title>
          <meta property="og:title" content="Circuit breakers in practice">
          <meta name="author" content="Ada Lovelace">
          <meta property="article:published_time" content="2024-03-01T10:00:00Z">
          <meta name="description" content="How breakers keep callers healthy.">
          <meta property="og:site_name" content="Example Engineering">
        </head>
        <body>
          <nav><a href="/home">Home</a><a href="/blog">Blog</a></nav>
          <article>
            <h2>Why breakers</h2>
            <p>A breaker stops calling a failing backend for a while, which gives the backend time
            to recover and keeps callers from piling up on a dependency that cannot answer.</p>
            <p>Read the <a href="/docs/breaker">breaker docs</a> or write to
            <a href="mailto:team@example.com">the team</a>.</p>
            <img src="/img/diagram.png" alt="diagram">
          </article>
          <footer>Copyright footer text</footer>
        </body>
        </html>
        """;

    private final MainContentExtractor extractor = new MainContentExtractor(new MarkdownRenderer());

    @Test
    public void shouldReadMetadata() {
        ExtractedDocument document = extractor.extract(ARTICLE_HTML, "https://blog.example.com/posts/1");

        assertThat(document.getUrl()).isEqualTo("https://blog.example.com/posts/1");
        assertThat(document.getTitle()).isEqualTo("Circuit breakers in practice");
        assertThat(document.getByline()).isEqualTo("Ada Lovelace");
        assertThat(document.getPublishedIso()).isEqualTo("2024-03-01T10:00:00Z");
        assertThat(document.getDescription()).isEqualTo("How breakers keep callers healthy.");
        assertThat(document.getSiteName()).isEqualTo("Example Engineering");
        assertThat(document.getLanguage()).isEqualTo("en");
    }

    @Test
    public void shouldKeepMainContentOnly() {
        ExtractedDocument document = extractor.extract(ARTICLE_HTML, "https://blog.example.com/posts/1");

        assertThat(document.getText()).contains("A breaker stops calling a failing backend");
        assertThat(document.getText()).doesNotContain("Copyright footer text");
        assertThat(document.getText()).doesNotContain("Home");
        assertThat(document.getMarkdown()).contains("## Why breakers");
        assertThat(document.getMarkdown()).contains("[breaker docs]");
        assertThat(document.getLinks()).containsExactly("https://blog.example.com/docs/breaker");
        assertThat(document.getMedia()).containsExactly("https://blog.example.com/img/diagram.png");
        assertThat(document.getWordCount()).isGreaterThan(30);
        assertThat(document.getReadingTime()).isEqualTo(1);
    }

    @Test
    public void shouldFallBackToTitleTagThenHeading() {
        ExtractedDocument withTitle = extractor.extract(
            "<html><head><title>Plain title</title></head><body><h1>Heading</h1></body></html>",
            "https://example.com"
        );
        ExtractedDocument withHeading = extractor.extract(
            "<html><body><h1>Heading</h1><p>body</p></body></html>",
            "https://example.com"
        );

        assertThat(withTitle.getTitle()).isEqualTo("Plain title");
        assertThat(withHeading.getTitle()).isEqualTo("Heading");
    }

    @Test
    public void shouldCapCollectedLinks() {
        StringBuilder html = new StringBuilder("<html><body><article><p>Index of pages.</p>");
        for (int i = 0; i < MainContentExtractor.MAX_LINKS + 50; i++) {
            html.append("<p><a href=\"/page/").append(i).append("\">page number ").append(i).append("</a></p>");
        }
        html.append("</article></body></html>");

        ExtractedDocument document = extractor.extract(html.toString(), "https://example.com");

        assertThat(document.getLinks()).hasSize(MainContentExtractor.MAX_LINKS);
        assertThat(document.getLinks().get(0)).isEqualTo("https://example.com/page/0");
    }

    @Test
    public void shouldHandleEmptyInput() {
        ExtractedDocument document = extractor.extract((String) null, null);

        assertThat(document.getTitle()).isEmpty();
        assertThat(document.getText()).isEmpty();
        assertThat(document.getMarkdown()).isEmpty();
        assertThat(document.getLinks()).isEmpty();
        assertThat(document.getWordCount()).isZero();
        assertThat(document.getReadingTime()).isZero();
    }

    @Test
    public void shouldCountWordsAndReadingTime() {
        assertThat(MainContentExtractor.countWords("  one two\n three  ")).isEqualTo(3);
        assertThat(MainContentExtractor.countWords(" ")).isZero();
        assertThat(MainContentExtractor.readingTimeOf(0)).isZero();
        assertThat(MainContentExtractor.readingTimeOf(1)).isEqualTo(1);
        assertThat(MainContentExtractor.readingTimeOf(200)).isEqualTo(1);
        assertThat(MainContentExtractor.readingTimeOf(201)).isEqualTo(2);
    }

}
