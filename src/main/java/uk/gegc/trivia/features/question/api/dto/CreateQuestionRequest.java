package uk.gegc.trivia.features.question.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * All four fields are required; missing ones are reported by the service.
 */
@Schema(name = "CreateQuestionRequest", description = "Payload for adding a question")
public record CreateQuestionRequest(
        @Schema(description = "Question text", example = "What is the heaviest organ in the human body?")
        String question,

        @Schema(description = "Answer text", example = "The Liver")
        String answer,

        @Schema(description = "Category ID", example = "1")
        Long category,

        @Schema(description = "Difficulty from 1 to 5", example = "4")
        Integer difficulty
) {
}
