package io.github.drompincen.scenarioagent.runtime.scenario;

import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ScriptFactory {

    private final ScenarioProperties properties;

    public ScriptFactory(ScenarioProperties properties) {
        this.properties = properties;
    }

    public FrameScript script() {
        return new FrameScript(properties.eventDelay());
    }

    public Duration stall() {
        return properties.stall();
    }
}
