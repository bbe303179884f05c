package fun.fengwk.rex.core.service.gate;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Gate routing configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "rex.gate")
public class GateProperties {

    /**
     * Scores at or above this value go straight to static parsing.
     */
    private double hiThreshold = 0.7D;

    /**
     * Scores at or below this value go straight to headless rendering.
     */
    private double loThreshold = 0.3D;

    /**
     * Prior used for hosts without a configured entry.
     */
    private double defaultDomainPrior = 0.5D;

    /**
     * Host suffix to historical success rate, e.g. {@code wikipedia.org -> 0.9}.
     */
    private Map<String, Double> domainPriors = new LinkedHashMap<>(Map.of(
        "wikipedia.org", 0.9D,
        "github.com", 0.9D,
        "medium.com", 0.8D,
        "dev.to", 0.8D
    ));

    public void validate() {
        if (hiThreshold < 0D || hiThreshold > 1D || loThreshold < 0D || loThreshold > 1D) {
            throw new IllegalArgumentException("gate thresholds must lie in [0, 1]");
        }
        if (loThreshold > hiThreshold) {
            throw new IllegalArgumentException("gate loThreshold must not exceed hiThreshold");
        }
        if (defaultDomainPrior < 0D || defaultDomainPrior > 1D) {
            throw new IllegalArgumentException("defaultDomainPrior must lie in [0, 1]");
        }
    }

}
