package fun.fengwk.rex.core.configuration;

import fun.fengwk.rex.core.service.breaker.CircuitBreakerRegistry;
import fun.fengwk.rex.core.service.breaker.CircuitEventListener;
import fun.fengwk.rex.core.service.pool.EngineLoader;
import fun.fengwk.rex.core.service.pool.ExtractionInstancePool;
import fun.fengwk.rex.core.service.pool.PoolEventListener;
import fun.fengwk.rex.core.service.pool.PoolProperties;
import fun.fengwk.rex.core.service.pool.ResourceLimiter;
import fun.fengwk.rex.core.service.reliability.DefaultSleeper;
import fun.fengwk.rex.core.service.reliability.ReliabilityProperties;
import fun.fengwk.rex.core.service.reliability.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Explicit singletons of the extraction runtime. Each backend gets exactly one breaker, created
 * here and injected into its callers.
 *
 * @author fengwk
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class ExtractionRuntimeConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock extractionClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public Sleeper extractionSleeper() {
        return new DefaultSleeper();
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceLimiter extractionResourceLimiter() {
        return ResourceLimiter.ALLOW_ALL;
    }

    @Bean
    @ConditionalOnMissingBean
    public PoolEventListener extractionPoolEventListener() {
        return event -> log.debug("pool event, type={}, instance={}, metadata={}",
            event.getType(), event.getInstanceId(), event.getMetadata());
    }

    @Bean
    @ConditionalOnMissingBean
    public CircuitEventListener extractionCircuitEventListener() {
        return event -> log.info("breaker health changed, breaker={}, from={}, to={}, failures={}",
            event.breakerName(), event.from(), event.to(), event.failureCount());
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(
        ReliabilityProperties reliabilityProperties,
        Clock clock,
        CircuitEventListener circuitEventListener
    ) {
        return CircuitBreakerRegistry.create(reliabilityProperties.toBreakerConfigs(), clock, circuitEventListener);
    }

    @Bean(destroyMethod = "shutdown")
    public ExtractionInstancePool extractionInstancePool(
        PoolProperties poolProperties,
        EngineLoader engineLoader,
        ResourceLimiter resourceLimiter,
        Clock clock,
        PoolEventListener poolEventListener
    ) {
        ExtractionInstancePool pool = new ExtractionInstancePool(
            "extraction",
            poolProperties.toPoolConfig(),
            engineLoader,
            resourceLimiter,
            clock,
            poolEventListener,
            null
        );
        pool.warmUp();
        if (poolProperties.getHealthCheckIntervalMs() > 0) {
            pool.startHealthMonitor();
        }
        return pool;
    }

}
