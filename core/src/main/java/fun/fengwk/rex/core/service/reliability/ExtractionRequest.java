package fun.fengwk.rex.core.service.reliability;

import fun.fengwk.rex.core.service.gate.GateFeatures;
import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;

/**
 * Input of a reliable extraction. Either content or url must be present; a request without
 * content can only be served by the headless backend.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
public class ExtractionRequest {

    String url;

    byte[] content;

    /**
     * Precomputed gate features, analyzed from the content when absent.
     */
    GateFeatures features;

    @Builder.Default
    boolean allowEscalation = true;

    public static ExtractionRequest ofHtml(String url, String html) {
        return ExtractionRequest.builder()
            .url(url)
            .content(html == null ? null : html.getBytes(StandardCharsets.UTF_8))
            .build();
    }

    public static ExtractionRequest ofUrl(String url) {
        return ExtractionRequest.builder().url(url).build();
    }

    public boolean hasContent() {
        return content != null && content.length > 0;
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

}
