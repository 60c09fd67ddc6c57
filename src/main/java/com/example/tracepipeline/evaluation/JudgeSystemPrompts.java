package com.example.tracepipeline.evaluation;

import com.example.tracepipeline.model.ScoreDataType;

/**
 * 评审模型的系统提示词，要求的 JSON 结构随分数类型变化。
 */
final class JudgeSystemPrompts {

    private static final String BASE = "You are an AI evaluation assistant. Your task is to evaluate AI agent "
            + "outputs based on the criteria provided.\n\n"
            + "Respond with a JSON object containing your evaluation. The JSON must include:\n"
            + "- \"reasoning\": A brief explanation of your evaluation (1-3 sentences)\n";

    private JudgeSystemPrompts() {
    }

    static String forDataType(ScoreDataType dataType) {
        switch (dataType) {
            case BOOLEAN:
                return BASE + "- \"passed\": A boolean (true/false) indicating if the criteria was met\n"
                        + "- \"score\": 1.0 if passed, 0.0 if not\n\n"
                        + "Example response:\n"
                        + "{\"passed\": true, \"score\": 1.0, \"reasoning\": \"The response correctly followed "
                        + "the instructions.\"}";
            case CATEGORICAL:
                return BASE + "- \"string_value\": The category that best matches the output\n"
                        + "- \"score\": A confidence score from 0.0 to 1.0\n\n"
                        + "Example response:\n"
                        + "{\"string_value\": \"positive\", \"score\": 0.9, \"reasoning\": \"The sentiment is "
                        + "clearly positive based on word choice.\"}";
            case NUMERIC:
            default:
                return BASE + "- \"score\": A numeric score from 0.0 to 1.0 (where 1.0 is best)\n\n"
                        + "Example response:\n"
                        + "{\"score\": 0.85, \"reasoning\": \"The response was accurate and helpful, but could "
                        + "have been more concise.\"}";
        }
    }
}
