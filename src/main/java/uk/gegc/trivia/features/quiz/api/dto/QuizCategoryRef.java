package uk.gegc.trivia.features.quiz.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.swagger.v3.oas.annotations.media.Schema;

@JsonIgnoreProperties(ignoreUnknown = true)
@Schema(description = "Category to play; id 0 means all categories")
public record QuizCategoryRef(
        @Schema(description = "Category ID, 0 for all", example = "0")
        Long id,

        @Schema(description = "Category label, informational only", example = "Science")
        String type
) {
}
