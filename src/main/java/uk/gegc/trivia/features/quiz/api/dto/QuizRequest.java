package uk.gegc.trivia.features.quiz.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "QuizRequest", description = "Request for the next quiz question")
public record QuizRequest(
        @JsonProperty("previous_questions")
        @Schema(description = "IDs of questions already asked in this quiz", example = "[5, 9]")
        List<Long> previousQuestions,

        @JsonProperty("quiz_category")
        @Schema(description = "Category to play")
        QuizCategoryRef quizCategory
) {
}
