package uk.gegc.trivia.features.category.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

@Schema(description = "All categories keyed by id")
public record CategoriesResponse(
        @Schema(description = "Category labels keyed by category ID", example = "{\"1\": \"Science\", \"2\": \"Art\"}")
        Map<Long, String> categories
) {

    @JsonProperty("success")
    public boolean success() {
        return true;
    }
}
