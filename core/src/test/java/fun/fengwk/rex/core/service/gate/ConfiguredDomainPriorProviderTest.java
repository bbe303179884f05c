package fun.fengwk.rex.core.service.gate;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class ConfiguredDomainPriorProviderTest {

    @Test
    public void shouldMatchHostSuffix() {
        ConfiguredDomainPriorProvider provider = new ConfiguredDomainPriorProvider(new GateProperties());

        assertThat(provider.priorOf("en.wikipedia.org")).isEqualTo(0.9D);
        assertThat(provider.priorOf("dev.to")).isEqualTo(0.8D);
        assertThat(provider.priorOf("notwikipedia.org")).isEqualTo(0.5D);
        assertThat(provider.priorOf("")).isEqualTo(0.5D);
    }

    @Test
    public void shouldPreferLongestSuffixAndClamp() {
        GateProperties properties = new GateProperties();
        Map<String, Double> priors = new LinkedHashMap<>();
        priors.put("example.com", 0.2D);
        priors.put("docs.example.com", 1.7D);
        properties.setDomainPriors(priors);
        properties.setDefaultDomainPrior(0.4D);
        ConfiguredDomainPriorProvider provider = new ConfiguredDomainPriorProvider(properties);

        assertThat(provider.priorOf("docs.example.com")).isEqualTo(1D);
        assertThat(provider.priorOf("www.example.com")).isEqualTo(0.2D);
        assertThat(provider.priorOf("other.org")).isEqualTo(0.4D);
    }

    @Test
    public void shouldRejectInvertedThresholds() {
        GateProperties properties = new GateProperties();
        properties.setHiThreshold(0.3D);
        properties.setLoThreshold(0.6D);

        assertThatThrownBy(properties::validate)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("loThreshold");
    }

}
