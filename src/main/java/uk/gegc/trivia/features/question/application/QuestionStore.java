package uk.gegc.trivia.features.question.application;

import uk.gegc.trivia.features.question.domain.model.NewQuestion;
import uk.gegc.trivia.features.question.domain.model.Question;
import uk.gegc.trivia.shared.exception.ValidationException;

import java.util.List;
import java.util.Optional;

/**
 * Access to the stored question records.
 *
 * <p>Listings are ordered by ascending id. Implementations serialize conflicting
 * inserts and deletes; callers hold no locks of their own.
 */
public interface QuestionStore {

    List<Question> listAll();

    List<Question> findByCategory(long categoryId);

    /**
     * Questions whose text contains {@code term}, ignoring case.
     */
    List<Question> findByTextSubstring(String term);

    Optional<Question> get(long id);

    /**
     * Stores a new question and assigns its id.
     *
     * @throws ValidationException if a field is missing or blank, the difficulty is out of
     *                             range, or the category does not exist
     */
    Question insert(NewQuestion fields);

    /**
     * @return {@code true} if a record existed and was removed
     */
    boolean delete(long id);
}
