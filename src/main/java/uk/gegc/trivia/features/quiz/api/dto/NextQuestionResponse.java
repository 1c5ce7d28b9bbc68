package uk.gegc.trivia.features.quiz.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.trivia.features.question.api.dto.QuestionDto;

@Schema(description = "Next quiz question")
public record NextQuestionResponse(
        @Schema(description = "Unseen question, or null once the quiz is complete", nullable = true)
        QuestionDto question
) {

    @JsonProperty("success")
    public boolean success() {
        return true;
    }

    @JsonProperty("quiz_complete")
    public boolean quizComplete() {
        return question == null;
    }
}
