package uk.gegc.trivia.features.question.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Confirmation of a created question")
public record QuestionCreated(
        @Schema(description = "ID assigned to the new question", example = "24")
        Long created,

        @JsonProperty("question_created")
        @Schema(description = "Text of the new question")
        String questionCreated,

        @Schema(description = "Requested page of all questions after the insert")
        List<QuestionDto> questions
) {

    @JsonProperty("success")
    public boolean success() {
        return true;
    }
}
