package io.github.drompincen.scenarioagent.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Body of {@code POST /a2a/respond}. The answer shape is recognised when its id is truthy and its
 * value key is present, checked in the order clarification, selection, plan approval.
 * {@link #answer()} is null when none matches.
 */
public record RespondRequest(
        String sessionId,
        String clarificationId,
        String selectionId,
        String planId,
        Answer answer
) {

    public static RespondRequest parse(JsonNode body) {
        String sessionId = JsonTruth.text(body.get("sessionId"), "");
        JsonNode clarificationId = body.get("clarificationId");
        JsonNode selectionId = body.get("selectionId");
        JsonNode planId = body.get("planId");

        Answer answer = null;
        if (JsonTruth.isTruthy(clarificationId) && body.has("answers")) {
            answer = new ClarificationAnswer(clarificationId.asText(), toAnswerMap(body.get("answers")));
        } else if (JsonTruth.isTruthy(selectionId) && body.has("selectedIds")) {
            answer = new SelectionAnswer(selectionId.asText(), toIdList(body.get("selectedIds")));
        } else if (JsonTruth.isTruthy(planId) && body.has("approved")) {
            answer = new PlanApproval(planId.asText(), JsonTruth.isTruthy(body.get("approved")));
        }

        return new RespondRequest(sessionId,
                JsonTruth.text(clarificationId, null),
                JsonTruth.text(selectionId, null),
                JsonTruth.text(planId, null),
                answer);
    }

    public boolean recognized() {
        return answer != null;
    }

    private static Map<String, JsonNode> toAnswerMap(JsonNode answers) {
        Map<String, JsonNode> map = new LinkedHashMap<>();
        if (answers != null && answers.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = answers.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                map.put(field.getKey(), field.getValue());
            }
        }
        return map;
    }

    private static List<String> toIdList(JsonNode ids) {
        List<String> list = new ArrayList<>();
        if (ids != null && ids.isArray()) {
            ids.forEach(id -> list.add(id.asText()));
        }
        return list;
    }
}
