package uk.gegc.trivia.features.question.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import uk.gegc.trivia.features.question.api.dto.*;
import uk.gegc.trivia.features.question.application.QuestionService;

@Tag(
        name = "Questions",
        description = "Browse, search, add and delete trivia questions"
)
@RestController
@RequestMapping("/api/v1/questions")
@RequiredArgsConstructor
public class QuestionController {

    private final QuestionService questionService;

    @Operation(
            summary = "List questions",
            description = "Get one page of all questions ordered by ID, with the total count and the category labels"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Page returned"),
            @ApiResponse(responseCode = "404", description = "Page is empty",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping
    public ResponseEntity<QuestionPage> listQuestions(
            @Parameter(description = "1-based page number") @RequestParam(defaultValue = "1") int page,
            @Parameter(description = "Page size, defaults to trivia.questions-per-page") @RequestParam(required = false) Integer size
    ) {
        QuestionPage result = (size == null
                ? questionService.listQuestionsPage(page)
                : questionService.listQuestionsPage(page, size))
                .orElseThrow();
        return ResponseEntity.ok(result);
    }

    @Operation(
            summary = "Create a question",
            description = "Add a question to an existing category and return the requested page of all questions"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Question created"),
            @ApiResponse(responseCode = "400", description = "A required field is missing",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Question could not be stored",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<QuestionCreated> createQuestion(
            @RequestBody CreateQuestionRequest request,
            @Parameter(description = "Page of the refreshed listing to return") @RequestParam(defaultValue = "1") int page
    ) {
        QuestionCreated created = questionService.createQuestion(request, page).orElseThrow();
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @Operation(
            summary = "Search questions",
            description = "Case-insensitive substring search over question text"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Matches returned"),
            @ApiResponse(responseCode = "400", description = "Search term missing",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Nothing matches",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/search")
    public ResponseEntity<QuestionSearchResult> searchQuestions(@RequestBody SearchQuestionsRequest request) {
        return ResponseEntity.ok(questionService.searchQuestions(request.searchTerm()).orElseThrow());
    }

    @Operation(
            summary = "Delete a question",
            description = "Delete a question by ID and return the requested page of the remaining questions"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Question deleted"),
            @ApiResponse(responseCode = "404", description = "Question not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "422", description = "Question could not be deleted",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @DeleteMapping("/{questionId}")
    public ResponseEntity<QuestionDeleted> deleteQuestion(
            @Parameter(description = "ID of the question", required = true) @PathVariable long questionId,
            @Parameter(description = "Page of the remaining questions to return") @RequestParam(defaultValue = "1") int page
    ) {
        return ResponseEntity.ok(questionService.deleteQuestion(questionId, page).orElseThrow());
    }
}
