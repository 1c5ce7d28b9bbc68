package uk.gegc.trivia.features.quiz.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.trivia.features.question.application.QuestionStore;
import uk.gegc.trivia.features.question.domain.model.Question;
import uk.gegc.trivia.shared.result.ErrorKind;
import uk.gegc.trivia.shared.result.OperationResult;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Picks the next quiz question at random among those the player has not seen.
 *
 * <p>Each call is independent: the caller carries the ids already asked.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QuizSelector {

    /**
     * Category id meaning "every category".
     */
    public static final long ALL_CATEGORIES = 0L;

    private final QuestionStore questionStore;
    private final Random quizRandom;

    /**
     * @return {@code NOT_FOUND} when the pool is empty, an empty optional when every pooled
     * question is in {@code previousIds}, otherwise a uniformly chosen unseen question
     */
    public OperationResult<Optional<Question>> nextQuestion(long categoryId, Set<Long> previousIds) {
        List<Question> pool = categoryId == ALL_CATEGORIES
                ? questionStore.listAll()
                : questionStore.findByCategory(categoryId);

        if (pool.isEmpty()) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "No questions available for category " + categoryId);
        }

        List<Question> unseen = pool.stream()
                .filter(question -> !previousIds.contains(question.getId()))
                .toList();
        if (unseen.isEmpty()) {
            log.debug("Quiz over category {} exhausted after {} questions", categoryId, pool.size());
            return OperationResult.success(Optional.empty());
        }

        return OperationResult.success(Optional.of(unseen.get(quizRandom.nextInt(unseen.size()))));
    }
}
