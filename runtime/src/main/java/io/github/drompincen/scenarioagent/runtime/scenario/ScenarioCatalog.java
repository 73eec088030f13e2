package io.github.drompincen.scenarioagent.runtime.scenario;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup table from scenario name to its handlers.
 */
@Service
public class ScenarioCatalog {

    private static final Logger log = LoggerFactory.getLogger(ScenarioCatalog.class);

    private final Map<ScenarioType, Scenario> scenarios = new EnumMap<>(ScenarioType.class);
    private final ScenarioProperties properties;

    public ScenarioCatalog(List<Scenario> scenarios, ScenarioProperties properties) {
        for (Scenario scenario : scenarios) {
            this.scenarios.put(scenario.type(), scenario);
        }
        for (ScenarioType type : ScenarioType.values()) {
            if (!this.scenarios.containsKey(type)) {
                throw new IllegalStateException("No handler registered for scenario " + type.scenarioName());
            }
        }
        this.properties = properties;
        if (ScenarioType.fromName(properties.scenario()).isEmpty()) {
            log.warn("[Scenario] Unknown scenario '{}' configured, messages will use {}",
                    properties.scenario(), ScenarioType.DIRECT_EXECUTION.scenarioName());
        }
    }

    public Optional<Scenario> find(String name) {
        return ScenarioType.fromName(name).map(scenarios::get);
    }

    /** The scenario for {@code name}, falling back to direct execution for unknown names. */
    public Scenario resolve(String name) {
        return find(name).orElseGet(() -> scenarios.get(ScenarioType.DIRECT_EXECUTION));
    }

    public String activeName() {
        return properties.scenario();
    }

    public List<String> names() {
        return ScenarioType.names();
    }
}
