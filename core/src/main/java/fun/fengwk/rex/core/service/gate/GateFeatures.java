package fun.fengwk.rex.core.service.gate;

import lombok.Builder;
import lombok.Value;

/**
 * Raw page signals consumed by {@link GateScorer}.
 *
 * <p>Values are expected to be sanitized by the producer: counts are non-negative and
 * {@code domainPrior} lies in {@code [0, 1]}.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
public class GateFeatures {

    long htmlBytes;
    long visibleTextChars;
    int paragraphCount;
    int articleTagCount;
    int headingCount;
    long scriptBytes;
    boolean hasOpenGraphTitle;
    boolean hasJsonLdArticle;

    /**
     * Bitset of {@link SpaMarker}, only the low 8 bits are meaningful.
     */
    int spaMarkerFlags;

    /**
     * Historical success rate for the page's domain.
     */
    @Builder.Default
    double domainPrior = 0.5D;

}
