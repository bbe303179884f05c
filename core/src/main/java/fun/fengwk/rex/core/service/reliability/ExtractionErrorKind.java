package fun.fengwk.rex.core.service.reliability;

/**
 * @author fengwk
 */
public enum ExtractionErrorKind {

    /**
     * Every mode used its retry and escalation budget without success.
     */
    ALL_MODES_EXHAUSTED,

    /**
     * The final attempt hit its epoch deadline.
     */
    TIMEOUT,

    /**
     * The breaker refused the only allowed mode, escalation was disabled.
     */
    CIRCUIT_OPEN,

    /**
     * The caller supplied deadline expired.
     */
    DEADLINE_EXCEEDED

}
