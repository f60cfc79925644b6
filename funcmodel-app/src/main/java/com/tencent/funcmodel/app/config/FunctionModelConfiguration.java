package com.tencent.funcmodel.app.config;

import com.tencent.funcmodel.domain.config.FunctionModelProperties;
import com.tencent.funcmodel.domain.context.ConflictResolution;
import com.tencent.funcmodel.domain.shared.IdGenerator;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.time.Clock;

/**
 * FunctionModelConfiguration - 应用装配
 * <p>
 * 扫描领域层与应用层组件，可调参数从 classpath:funcmodel.properties 读取。
 * </p>
 */
@Configuration
@ComponentScan("com.tencent.funcmodel")
@PropertySource("classpath:funcmodel.properties")
public class FunctionModelConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IdGenerator idGenerator() {
        return IdGenerator.uuid();
    }

    @Bean
    public FunctionModelProperties functionModelProperties(
            @Value("${funcmodel.context.max-hierarchy-depth:10}") int maxHierarchyDepth,
            @Value("${funcmodel.context.default-conflict-resolution:first-wins}") String conflictResolution,
            @Value("${funcmodel.action.default-priority:5}") int defaultActionPriority,
            @Value("${funcmodel.action.default-max-retries:0}") int defaultMaxRetries,
            @Value("${funcmodel.dry-run.simulated-action-duration-ms:1000}") long simulatedActionDurationMs) {
        return FunctionModelProperties.builder()
                .maxHierarchyDepth(maxHierarchyDepth)
                .defaultConflictResolution(ConflictResolution.fromValue(conflictResolution)
                        .orElse(ConflictResolution.FIRST_WINS))
                .defaultActionPriority(defaultActionPriority)
                .defaultMaxRetries(defaultMaxRetries)
                .simulatedActionDurationMs(simulatedActionDurationMs)
                .build();
    }

    @Bean(destroyMethod = "close")
    public ValidatorFactory validatorFactory() {
        return Validation.buildDefaultValidatorFactory();
    }

    @Bean
    public Validator validator(ValidatorFactory validatorFactory) {
        return validatorFactory.getValidator();
    }
}
