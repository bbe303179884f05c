package fun.fengwk.rex.core.service.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured content extracted from a page.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedDocument {

    private String url;

    private String title;

    private String byline;

    /**
     * Published time as found in the page, ISO-8601 when the page uses it.
     */
    private String publishedIso;

    private String description;

    private String siteName;

    private String language;

    /**
     * Plain text of the main content.
     */
    private String text;

    private String markdown;

    @Builder.Default
    private List<String> links = new ArrayList<>();

    @Builder.Default
    private List<String> media = new ArrayList<>();

    private int wordCount;

    /**
     * Estimated reading time in minutes.
     */
    private int readingTime;

    private double qualityScore;

    /**
     * Mode that produced this document, one of {@code raw}, {@code probes} or {@code headless}.
     */
    private String extractionMode;

    /**
     * Set when the document came from a fallback path rather than the initially chosen mode.
     */
    private boolean degraded;

}
