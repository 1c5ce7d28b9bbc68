package uk.gegc.trivia.features.quiz.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.trivia.features.quiz.api.dto.NextQuestionResponse;
import uk.gegc.trivia.features.quiz.api.dto.QuizRequest;
import uk.gegc.trivia.features.quiz.application.QuizService;

@Tag(
        name = "Quizzes",
        description = "Play a quiz one question at a time"
)
@RestController
@RequestMapping("/api/v1/quizzes")
@RequiredArgsConstructor
public class QuizController {

    private final QuizService quizService;

    @Operation(
            summary = "Next quiz question",
            description = "Get a random question not in previous_questions; question is null once all were asked"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Next question, or null when the quiz is complete"),
            @ApiResponse(responseCode = "400", description = "previous_questions or quiz_category missing",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Category has no questions",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<NextQuestionResponse> nextQuestion(@RequestBody QuizRequest request) {
        return ResponseEntity.ok(quizService.nextQuestion(request).orElseThrow());
    }
}
