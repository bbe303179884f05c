package fun.fengwk.rex.core.configuration;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Import;

/**
 * Registers the extraction core services.
 *
 * @author fengwk
 */
@AutoConfiguration
@EnableConfigurationProperties
@ComponentScan("fun.fengwk.rex.core.service")
@Import(ExtractionRuntimeConfiguration.class)
public class ExtractionCoreAutoConfiguration {

}
