package uk.gegc.trivia.features.quiz.application;

import uk.gegc.trivia.features.quiz.api.dto.NextQuestionResponse;
import uk.gegc.trivia.features.quiz.api.dto.QuizRequest;
import uk.gegc.trivia.shared.result.OperationResult;

public interface QuizService {

    OperationResult<NextQuestionResponse> nextQuestion(QuizRequest request);
}
