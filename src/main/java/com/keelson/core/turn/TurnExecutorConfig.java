package com.keelson.core.turn;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.keelson.core.config.KeelsonProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the turn executor with {@code keelson.agent.executor}.
 */
@Configuration
public class TurnExecutorConfig {

    @Bean
    @ConditionalOnProperty(name = "keelson.agent.executor", havingValue = "echo", matchIfMissing = true)
    public TurnExecutor echoTurnExecutor(KeelsonProperties properties) {
        return new EchoTurnExecutor(properties.getAgent().getEchoStepDelayMs());
    }

    @Bean
    @ConditionalOnProperty(name = "keelson.agent.executor", havingValue = "process")
    public TurnExecutor processTurnExecutor(KeelsonProperties properties, ObjectMapper objectMapper) {
        return new ProcessTurnExecutor(properties.getAgent().getCommand(), objectMapper);
    }
}
