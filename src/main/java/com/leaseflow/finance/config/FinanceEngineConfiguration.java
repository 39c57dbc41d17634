package com.leaseflow.finance.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Wires the engine's services. The importing application must provide
 * {@link com.leaseflow.finance.repository.TaxCodeRepository} and
 * {@link com.leaseflow.finance.repository.CostCenterRepository} beans.
 */
@Configuration
@ComponentScan(basePackages = "com.leaseflow.finance.service")
@EnableConfigurationProperties(FinanceEngineProperties.class)
public class FinanceEngineConfiguration {

    @Bean
    public Clock financeEngineClock(FinanceEngineProperties properties) {
        return Clock.system(ZoneId.of(properties.getZoneId()));
    }

    @Bean
    public LocalValidatorFactoryBean documentValidatorFactory() {
        return new LocalValidatorFactoryBean();
    }
}
