package io.b2mash.einvoice.config;

import io.b2mash.einvoice.format.RegulatorFormats;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Entry point for host applications: {@code @Import(ComplianceEngineConfiguration.class)} registers
 * every compliance service together with its bound {@link ComplianceProperties}.
 */
@Configuration
@ComponentScan(basePackages = "io.b2mash.einvoice")
@EnableConfigurationProperties(ComplianceProperties.class)
public class ComplianceEngineConfiguration {

  @Bean
  @ConditionalOnMissingBean
  Clock complianceClock() {
    return Clock.system(RegulatorFormats.TURKEY_OFFSET);
  }
}
