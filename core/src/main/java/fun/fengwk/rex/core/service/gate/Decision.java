package fun.fengwk.rex.core.service.gate;

/**
 * Extraction mode chosen by the gate.
 *
 * <p>Declaration order is the escalation order: each mode is more expensive and more
 * reliable than the one before it.
 *
 * @author fengwk
 */
public enum Decision {

    /**
     * Static parsing of the fetched html only.
     */
    RAW("raw"),

    /**
     * Static parsing whose result must pass a quality probe before it is accepted.
     */
    PROBES_FIRST("probes"),

    /**
     * Full headless browser rendering.
     */
    HEADLESS("headless");

    private final String value;

    Decision(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Next stricter mode, or {@code null} when this is already the strictest one.
     */
    public Decision next() {
        int nextOrdinal = ordinal() + 1;
        Decision[] decisions = values();
        return nextOrdinal < decisions.length ? decisions[nextOrdinal] : null;
    }

    public boolean usesInstancePool() {
        return this != HEADLESS;
    }

    public static Decision fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        for (Decision decision : values()) {
            if (decision.value.equalsIgnoreCase(value.trim()) || decision.name().equalsIgnoreCase(value.trim())) {
                return decision;
            }
        }
        throw new IllegalArgumentException("unsupported mode: " + value);
    }

}
