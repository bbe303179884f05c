package fun.fengwk.rex.core.service.gate;

/**
 * Source of historical per-domain extraction success rates.
 *
 * @author fengwk
 */
public interface DomainPriorProvider {

    /**
     * @param host lower-cased host, may be empty
     * @return prior in {@code [0, 1]}
     */
    double priorOf(String host);

}
