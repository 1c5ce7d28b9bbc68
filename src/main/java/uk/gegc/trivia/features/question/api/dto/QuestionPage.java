package uk.gegc.trivia.features.question.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "One page of questions with catalog context")
public record QuestionPage(
        @Schema(description = "Questions on the requested page")
        List<QuestionDto> questions,

        @JsonProperty("total_questions")
        @Schema(description = "Number of all stored questions, not only this page", example = "19")
        long totalQuestions,

        @Schema(description = "Category labels in catalog order")
        List<String> categories,

        @JsonProperty("current_category")
        @Schema(description = "Always null for the unfiltered listing", nullable = true)
        String currentCategory
) {

    @JsonProperty("success")
    public boolean success() {
        return true;
    }
}
