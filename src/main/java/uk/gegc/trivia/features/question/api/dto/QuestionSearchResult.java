package uk.gegc.trivia.features.question.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Questions matching a search term")
public record QuestionSearchResult(
        List<QuestionDto> questions,

        @JsonProperty("total_questions")
        @Schema(description = "Number of matches", example = "2")
        long totalQuestions,

        @JsonProperty("current_category")
        @Schema(description = "Always null, matches span categories", nullable = true)
        String currentCategory
) {

    @JsonProperty("success")
    public boolean success() {
        return true;
    }
}
