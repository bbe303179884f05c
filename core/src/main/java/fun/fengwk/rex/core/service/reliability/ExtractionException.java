package fun.fengwk.rex.core.service.reliability;

import lombok.Getter;

/**
 * Terminal failure of a reliable extraction. The cause is the last underlying error observed.
 *
 * @author fengwk
 */
@Getter
public class ExtractionException extends RuntimeException {

    private final ExtractionErrorKind kind;
    private final ReliabilityStats stats;

    public ExtractionException(ExtractionErrorKind kind, String message, Throwable cause, ReliabilityStats stats) {
        super(message, cause);
        this.kind = kind;
        this.stats = stats;
    }

}
