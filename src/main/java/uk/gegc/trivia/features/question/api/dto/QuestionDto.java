package uk.gegc.trivia.features.question.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Question as shown to trivia players")
public record QuestionDto(
        @Schema(description = "Question ID", example = "5")
        Long id,

        @Schema(description = "Question text", example = "Whose autobiography is entitled 'I Know Why the Caged Bird Sings'?")
        String question,

        @Schema(description = "Answer text", example = "Maya Angelou")
        String answer,

        @Schema(description = "Category ID", example = "4")
        Long category,

        @Schema(description = "Difficulty from 1 to 5", example = "2")
        Integer difficulty
) {
}
