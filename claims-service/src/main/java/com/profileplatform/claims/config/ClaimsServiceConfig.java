package com.profileplatform.claims.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.profileplatform.common.config.InferenceConfig;
import com.profileplatform.common.inference.InferenceEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.ReactiveTransactionManager;
import org.springframework.transaction.reactive.TransactionalOperator;

@Configuration
public class ClaimsServiceConfig {

    @Value("${inference.config-location:classpath:inference/inference.v0.5.1.json}")
    private String inferenceConfigLocation;

    @Bean
    public InferenceConfig inferenceConfig(InferenceConfigLoader loader) {
        return loader.load(inferenceConfigLocation);
    }

    @Bean
    public InferenceEngine inferenceEngine() {
        return InferenceEngine.defaults();
    }

    @Bean
    public TransactionalOperator transactionalOperator(ReactiveTransactionManager transactionManager) {
        return TransactionalOperator.create(transactionManager);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }
}
