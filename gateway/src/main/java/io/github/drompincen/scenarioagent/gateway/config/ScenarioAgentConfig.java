package io.github.drompincen.scenarioagent.gateway.config;

import io.github.drompincen.scenarioagent.runtime.scenario.ScenarioProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;

import java.time.Duration;

@Configuration
public class ScenarioAgentConfig {

    private static final Logger log = LoggerFactory.getLogger(ScenarioAgentConfig.class);

    @Value("${server.port:9999}")
    private int port;

    @Bean
    ScenarioProperties scenarioProperties(
            @Value("${scenario-agent.scenario:full_plan_mode}") String scenario,
            @Value("${scenario-agent.agent-id:test-workflow-agent}") String agentId,
            @Value("${scenario-agent.event-delay-ms:50}") long eventDelayMs,
            @Value("${scenario-agent.stall-ms:600000}") long stallMs) {
        return new ScenarioProperties(scenario, agentId, Duration.ofMillis(eventDelayMs), Duration.ofMillis(stallMs));
    }

    @EventListener(ApplicationReadyEvent.class)
    void logStartup(ApplicationReadyEvent event) {
        ScenarioProperties properties = event.getApplicationContext().getBean(ScenarioProperties.class);
        log.info("[Agent] {} listening on port {}", properties.agentId(), port);
        log.info("[Agent] Scenario: {}, event delay: {}ms", properties.scenario(), properties.eventDelay().toMillis());
    }
}
