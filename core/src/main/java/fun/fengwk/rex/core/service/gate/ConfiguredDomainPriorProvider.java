package fun.fengwk.rex.core.service.gate;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Domain priors looked up from {@link GateProperties#getDomainPriors()} by host suffix.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class ConfiguredDomainPriorProvider implements DomainPriorProvider {

    private final GateProperties gateProperties;

    @Override
    public double priorOf(String host) {
        double fallback = clampPrior(gateProperties.getDefaultDomainPrior());
        if (host == null || host.isBlank() || gateProperties.getDomainPriors() == null) {
            return fallback;
        }
        String normalizedHost = host.trim().toLowerCase(Locale.ROOT);
        String bestSuffix = null;
        double bestPrior = fallback;
        for (Map.Entry<String, Double> entry : gateProperties.getDomainPriors().entrySet()) {
            String suffix = entry.getKey() == null ? "" : entry.getKey().trim().toLowerCase(Locale.ROOT);
            if (suffix.isEmpty() || entry.getValue() == null) {
                continue;
            }
            boolean matches = normalizedHost.equals(suffix) || normalizedHost.endsWith("." + suffix);
            // Longest suffix wins so that docs.example.com can override example.com.
            if (matches && (bestSuffix == null || suffix.length() > bestSuffix.length())) {
                bestSuffix = suffix;
                bestPrior = clampPrior(entry.getValue());
            }
        }
        return bestPrior;
    }

    private double clampPrior(double prior) {
        if (Double.isNaN(prior)) {
            return 0.5D;
        }
        return Math.max(0D, Math.min(1D, prior));
    }

}
