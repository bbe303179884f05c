package fun.fengwk.rex.core.service.reliability;

import fun.fengwk.rex.core.service.engine.ExtractedDocument;
import org.springframework.stereotype.Component;

/**
 * Scores an extracted document in {@code [0, 1]} from title, text length, markdown structure and
 * metadata presence.
 *
 * @author fengwk
 */
@Component
public class QualityEvaluator {

    public double evaluate(ExtractedDocument document) {
        if (document == null) {
            return 0D;
        }
        double score = 0D;
        if (isPresent(document.getTitle())) {
            score += 0.2D;
        }

        int textLength = document.getText() == null ? 0 : document.getText().length();
        if (textLength > 1000) {
            score += 0.4D;
        } else if (textLength > 200) {
            score += 0.2D;
        }

        int indicators = countStructureIndicators(document.getMarkdown());
        if (indicators > 5) {
            score += 0.2D;
        } else if (indicators > 2) {
            score += 0.1D;
        }

        if (isPresent(document.getByline())) {
            score += 0.05D;
        }
        if (isPresent(document.getPublishedIso())) {
            score += 0.05D;
        }
        if (isPresent(document.getDescription())) {
            score += 0.05D;
        }
        if (document.getLinks() != null && !document.getLinks().isEmpty()) {
            score += 0.05D;
        }
        return Math.min(1D, score);
    }

    private int countStructureIndicators(String markdown) {
        if (markdown == null) {
            return 0;
        }
        int count = 0;
        for (int i = 0; i < markdown.length(); i++) {
            char c = markdown.charAt(i);
            if (c == '#' || c == '*' || c == '[') {
                count++;
            }
        }
        return count;
    }

    private boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }

}
