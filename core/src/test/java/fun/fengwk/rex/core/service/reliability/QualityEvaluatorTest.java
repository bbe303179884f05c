package fun.fengwk.rex.core.service.reliability;

import fun.fengwk.rex.core.service.engine.ExtractedDocument;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * @author fengwk
 */
public class QualityEvaluatorTest {

    private final QualityEvaluator qualityEvaluator = new QualityEvaluator();

    @Test
    public void shouldScoreCompleteDocumentAsOne() {
        ExtractedDocument document = ExtractedDocument.builder()
            .title("Title")
            .text("x".repeat(1001))
            .markdown("# A\n## B\n### C\n* item")
            .byline("Author")
            .publishedIso("2024-01-01")
            .description("Summary")
            .links(List.of("https://example.com"))
            .build();

        assertThat(qualityEvaluator.evaluate(document)).isCloseTo(1D, within(1e-9));
    }

    @Test
    public void shouldScoreEachSignalSeparately() {
        ExtractedDocument titleOnly = ExtractedDocument.builder().title("Title").build();
        ExtractedDocument mediumText = ExtractedDocument.builder().text("x".repeat(201)).build();
        ExtractedDocument shortText = ExtractedDocument.builder().text("x".repeat(200)).build();
        ExtractedDocument someStructure = ExtractedDocument.builder().markdown("# a [b] *c*").build();

        assertThat(qualityEvaluator.evaluate(titleOnly)).isCloseTo(0.2D, within(1e-9));
        assertThat(qualityEvaluator.evaluate(mediumText)).isCloseTo(0.2D, within(1e-9));
        assertThat(qualityEvaluator.evaluate(shortText)).isZero();
        assertThat(qualityEvaluator.evaluate(someStructure)).isCloseTo(0.1D, within(1e-9));
    }

    @Test
    public void shouldScoreEmptyDocumentAsZero() {
        assertThat(qualityEvaluator.evaluate(new ExtractedDocument())).isZero();
        assertThat(qualityEvaluator.evaluate(null)).isZero();
    }

}
