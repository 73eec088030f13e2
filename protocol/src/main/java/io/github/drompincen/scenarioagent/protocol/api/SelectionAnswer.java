package io.github.drompincen.scenarioagent.protocol.api;

import java.util.List;

public record SelectionAnswer(String selectionId, List<String> selectedIds) implements Answer {

    @Override
    public String promptId() {
        return selectionId;
    }
}
