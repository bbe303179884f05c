package fun.fengwk.rex.core.service.gate;

/**
 * Scores page signals and picks an extraction mode.
 *
 * <p>The weights are part of the routing contract, changing any of them changes which pages
 * go to the headless backend.
 *
 * @author fengwk
 */
public final class GateScorer {

    private static final double TEXT_RATIO_WEIGHT = 1.2D;
    private static final double TEXT_RATIO_CAP = 0.6D;
    private static final double PARAGRAPH_WEIGHT = 0.06D;
    private static final double PARAGRAPH_CAP = 0.3D;
    private static final double ARTICLE_BONUS = 0.15D;
    private static final double OPEN_GRAPH_BONUS = 0.08D;
    private static final double JSON_LD_BONUS = 0.12D;
    private static final double SCRIPT_DENSITY_WEIGHT = 0.8D;
    private static final double SCRIPT_DENSITY_CAP = 0.4D;
    private static final double SPA_PENALTY = 0.25D;
    private static final int SPA_PENALTY_MARKERS = 2;
    private static final int SPA_HEADLESS_MARKERS = 3;
    private static final double DOMAIN_PRIOR_WEIGHT = 0.1D;

    private GateScorer() {
    }

    /**
     * Deterministic score in {@code [0, 1]}, higher means static parsing is more likely to work.
     */
    public static double score(GateFeatures features) {
        double textRatio = ratio(features.getVisibleTextChars(), features.getHtmlBytes());
        double scriptDensity = ratio(features.getScriptBytes(), features.getHtmlBytes());

        double score = clamp(textRatio * TEXT_RATIO_WEIGHT, 0D, TEXT_RATIO_CAP);
        score += clamp(Math.log(features.getParagraphCount() + 1D) * PARAGRAPH_WEIGHT, 0D, PARAGRAPH_CAP);
        if (features.getArticleTagCount() > 0) {
            score += ARTICLE_BONUS;
        }
        if (features.isHasOpenGraphTitle()) {
            score += OPEN_GRAPH_BONUS;
        }
        if (features.isHasJsonLdArticle()) {
            score += JSON_LD_BONUS;
        }
        score -= clamp(scriptDensity * SCRIPT_DENSITY_WEIGHT, 0D, SCRIPT_DENSITY_CAP);
        if (SpaMarker.countSetBits(features.getSpaMarkerFlags()) >= SPA_PENALTY_MARKERS) {
            score -= SPA_PENALTY;
        }
        score += (features.getDomainPrior() - 0.5D) * DOMAIN_PRIOR_WEIGHT;
        return clamp(score, 0D, 1D);
    }

    public static Decision decide(GateFeatures features, double hiThreshold, double loThreshold) {
        double score = score(features);
        if (score >= hiThreshold) {
            return Decision.RAW;
        }
        if (score <= loThreshold || SpaMarker.countSetBits(features.getSpaMarkerFlags()) >= SPA_HEADLESS_MARKERS) {
            return Decision.HEADLESS;
        }
        return Decision.PROBES_FIRST;
    }

    private static double ratio(long numerator, long denominator) {
        if (denominator <= 0) {
            return 0D;
        }
        return numerator / (double) denominator;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

}
