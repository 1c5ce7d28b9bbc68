package uk.gegc.trivia.features.question.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "SearchQuestionsRequest", description = "Case-insensitive substring search over question text")
public record SearchQuestionsRequest(
        @JsonProperty("searchTerm")
        @Schema(description = "Term to look for; empty matches every question", example = "title")
        String searchTerm
) {
}
