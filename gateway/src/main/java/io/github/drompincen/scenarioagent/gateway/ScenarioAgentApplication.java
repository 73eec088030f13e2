package io.github.drompincen.scenarioagent.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.scenarioagent")
public class ScenarioAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(ScenarioAgentApplication.class, args);
    }
}
