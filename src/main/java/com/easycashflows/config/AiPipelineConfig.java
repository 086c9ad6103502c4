package com.easycashflows.config;

import com.easycashflows.service.ai.BusinessContextSource;
import com.easycashflows.service.ai.EmptyBusinessContextSource;
import com.easycashflows.service.ai.RetryPolicy;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AiPipelineConfig {

    @Bean
    public RetryPolicy aiRetryPolicy(AiProperties properties) {
        AiProperties.Retry retry = properties.retry();
        return new RetryPolicy(retry.resolveMaxAttempts(), retry.resolveBaseDelayMs(), retry.resolveMaxDelayMs());
    }

    @Bean
    @ConditionalOnMissingBean(BusinessContextSource.class)
    public BusinessContextSource businessContextSource() {
        return new EmptyBusinessContextSource();
    }
}
