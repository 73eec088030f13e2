package io.github.drompincen.scenarioagent.protocol.payload;

import java.util.List;

public record ClarificationQuestion(
        String questionId,
        String questionType,
        String question,
        String header,
        List<QuestionOption> options
) {
    public static ClarificationQuestion singleChoice(String questionId, String question, String header,
                                                     QuestionOption... options) {
        return new ClarificationQuestion(questionId, "single_choice", question, header, List.of(options));
    }
}
