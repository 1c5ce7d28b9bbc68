package uk.gegc.trivia.features.question.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Confirmation of a deleted question")
public record QuestionDeleted(
        @Schema(description = "ID of the removed question", example = "9")
        Long deleted,

        @Schema(description = "Requested page of the remaining questions")
        List<QuestionDto> questions
) {

    @JsonProperty("success")
    public boolean success() {
        return true;
    }
}
