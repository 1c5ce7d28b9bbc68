package uk.gegc.trivia.features.category.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Category DTO")
public record CategoryDto(
        @Schema(description = "Category ID", example = "1")
        Long id,

        @Schema(description = "Category label", example = "Science")
        String type
) {
}
