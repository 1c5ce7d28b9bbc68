package uk.gegc.trivia.features.quiz.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import uk.gegc.trivia.features.question.infra.mapping.QuestionMapper;
import uk.gegc.trivia.features.quiz.api.dto.NextQuestionResponse;
import uk.gegc.trivia.features.quiz.api.dto.QuizRequest;
import uk.gegc.trivia.features.quiz.application.QuizSelector;
import uk.gegc.trivia.features.quiz.application.QuizService;
import uk.gegc.trivia.shared.result.ErrorKind;
import uk.gegc.trivia.shared.result.OperationResult;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class QuizServiceImpl implements QuizService {

    private final QuizSelector quizSelector;

    @Override
    public OperationResult<NextQuestionResponse> nextQuestion(QuizRequest request) {
        if (request == null || request.previousQuestions() == null
                || request.quizCategory() == null || request.quizCategory().id() == null) {
            return OperationResult.failure(ErrorKind.INVALID_REQUEST,
                    "Both previous_questions and quiz_category.id are required");
        }

        Set<Long> previousIds = new HashSet<>();
        request.previousQuestions().stream()
                .filter(Objects::nonNull)
                .forEach(previousIds::add);

        return quizSelector.nextQuestion(request.quizCategory().id(), previousIds)
                .map(next -> new NextQuestionResponse(next.map(QuestionMapper::toDto).orElse(null)));
    }
}
