package uk.gegc.trivia.features.question.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Questions of one category")
public record CategoryQuestions(
        List<QuestionDto> questions,

        @JsonProperty("total_questions")
        @Schema(description = "Number of questions in the category", example = "4")
        long totalQuestions,

        @JsonProperty("current_category")
        @Schema(description = "Requested category ID as a string", example = "1")
        String currentCategory
) {

    @JsonProperty("success")
    public boolean success() {
        return true;
    }
}
