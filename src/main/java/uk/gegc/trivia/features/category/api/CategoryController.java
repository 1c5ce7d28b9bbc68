package uk.gegc.trivia.features.category.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.trivia.features.category.api.dto.CategoriesResponse;
import uk.gegc.trivia.features.category.api.dto.CategoryDto;
import uk.gegc.trivia.features.category.application.CategoryCatalog;
import uk.gegc.trivia.features.question.api.dto.CategoryQuestions;
import uk.gegc.trivia.features.question.application.QuestionService;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Tag(
        name = "Categories",
        description = "Read the category catalog and its questions"
)
@RestController
@RequestMapping("/api/v1/categories")
@RequiredArgsConstructor
public class CategoryController {

    private final CategoryCatalog categoryCatalog;
    private final QuestionService questionService;

    @Operation(
            summary = "List categories",
            description = "Get every category label keyed by its ID"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Categories returned"),
            @ApiResponse(responseCode = "404", description = "Catalog is empty",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping
    public ResponseEntity<CategoriesResponse> getCategories() {
        List<CategoryDto> categories = categoryCatalog.listAll().orElseThrow();
        Map<Long, String> byId = new LinkedHashMap<>();
        categories.forEach(category -> byId.put(category.id(), category.type()));
        return ResponseEntity.ok(new CategoriesResponse(byId));
    }

    @Operation(
            summary = "List questions of a category",
            description = "Get every question of a category; unknown and empty categories both yield 404"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Questions returned"),
            @ApiResponse(responseCode = "404", description = "Category has no questions",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{categoryId}/questions")
    public ResponseEntity<CategoryQuestions> getQuestionsByCategory(
            @Parameter(description = "ID of the category", required = true)
            @PathVariable long categoryId
    ) {
        return ResponseEntity.ok(questionService.listByCategory(categoryId).orElseThrow());
    }
}
