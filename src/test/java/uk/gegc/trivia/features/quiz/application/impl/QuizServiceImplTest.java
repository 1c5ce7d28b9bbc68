package uk.gegc.trivia.features.quiz.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.trivia.features.question.domain.model.Question;
import uk.gegc.trivia.features.quiz.api.dto.NextQuestionResponse;
import uk.gegc.trivia.features.quiz.api.dto.QuizCategoryRef;
import uk.gegc.trivia.features.quiz.api.dto.QuizRequest;
import uk.gegc.trivia.features.quiz.application.QuizSelector;
import uk.gegc.trivia.shared.result.ErrorKind;
import uk.gegc.trivia.shared.result.OperationResult;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("QuizServiceImpl Unit Tests")
class QuizServiceImplTest {

    @Mock
    private QuizSelector quizSelector;
    @InjectMocks
    private QuizServiceImpl quizService;

    @Test
    @DisplayName("nextQuestion: maps the picked question")
    void nextQuestion_mapsPick() {
        Question picked = new Question(7L, "Who invented Peanut Butter?", "George Washington Carver", 4L, 2);
        when(quizSelector.nextQuestion(4L, Set.of(5L, 9L))).thenReturn(OperationResult.success(Optional.of(picked)));

        NextQuestionResponse response = quizService.nextQuestion(
                new QuizRequest(List.of(5L, 9L), new QuizCategoryRef(4L, "History"))).orElseThrow();

        assertThat(response.question()).isNotNull();
        assertThat(response.question().id()).isEqualTo(7L);
        assertThat(response.question().answer()).isEqualTo("George Washington Carver");
        assertThat(response.quizComplete()).isFalse();
    }

    @Test
    @DisplayName("nextQuestion: exhausted pool gives a null question")
    void nextQuestion_exhausted() {
        when(quizSelector.nextQuestion(0L, Set.of(1L))).thenReturn(OperationResult.success(Optional.empty()));

        NextQuestionResponse response = quizService.nextQuestion(
                new QuizRequest(List.of(1L), new QuizCategoryRef(0L, "click"))).orElseThrow();

        assertThat(response.question()).isNull();
        assertThat(response.quizComplete()).isTrue();
    }

    @Test
    @DisplayName("nextQuestion: NOT_FOUND from the selector is passed through")
    void nextQuestion_notFoundPassesThrough() {
        when(quizSelector.nextQuestion(1000L, Set.of())).thenReturn(OperationResult.failure(ErrorKind.NOT_FOUND));

        OperationResult<NextQuestionResponse> result = quizService.nextQuestion(
                new QuizRequest(List.of(), new QuizCategoryRef(1000L, null)));

        assertThat(result.errorKind()).contains(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("nextQuestion: null ids in previous_questions are skipped")
    void nextQuestion_nullPreviousIdsSkipped() {
        when(quizSelector.nextQuestion(0L, Set.of(3L))).thenReturn(OperationResult.success(Optional.empty()));

        quizService.nextQuestion(new QuizRequest(Arrays.asList(3L, null), new QuizCategoryRef(0L, null)));

        verify(quizSelector).nextQuestion(0L, Set.of(3L));
    }

    @Test
    @DisplayName("nextQuestion: missing previous_questions or category is INVALID_REQUEST")
    void nextQuestion_missingFields() {
        assertThat(quizService.nextQuestion(new QuizRequest(null, new QuizCategoryRef(1L, "Science"))).errorKind())
                .contains(ErrorKind.INVALID_REQUEST);
        assertThat(quizService.nextQuestion(new QuizRequest(List.of(), null)).errorKind())
                .contains(ErrorKind.INVALID_REQUEST);
        assertThat(quizService.nextQuestion(new QuizRequest(List.of(), new QuizCategoryRef(null, "Science"))).errorKind())
                .contains(ErrorKind.INVALID_REQUEST);
        verifyNoInteractions(quizSelector);
    }
}
