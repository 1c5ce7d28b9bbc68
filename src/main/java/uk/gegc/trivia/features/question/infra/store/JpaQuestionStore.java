package uk.gegc.trivia.features.question.infra.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.trivia.features.category.domain.repository.CategoryRepository;
import uk.gegc.trivia.features.question.application.QuestionStore;
import uk.gegc.trivia.features.question.domain.model.NewQuestion;
import uk.gegc.trivia.features.question.domain.model.Question;
import uk.gegc.trivia.features.question.domain.repository.QuestionRepository;
import uk.gegc.trivia.features.question.infra.mapping.QuestionMapper;
import uk.gegc.trivia.shared.exception.ValidationException;

import java.util.List;
import java.util.Optional;

/**
 * {@link QuestionStore} backed by Spring Data JPA. Each call runs in its own transaction.
 */
@Slf4j
@Component
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class JpaQuestionStore implements QuestionStore {

    public static final int MIN_DIFFICULTY = 1;
    public static final int MAX_DIFFICULTY = 5;

    private final QuestionRepository questionRepository;
    private final CategoryRepository categoryRepository;

    @Override
    public List<Question> listAll() {
        return questionRepository.findAllByOrderByIdAsc();
    }

    @Override
    public List<Question> findByCategory(long categoryId) {
        return questionRepository.findAllByCategoryIdOrderByIdAsc(categoryId);
    }

    @Override
    public List<Question> findByTextSubstring(String term) {
        return questionRepository.findAllByQuestionTextContainingIgnoreCaseOrderByIdAsc(term == null ? "" : term);
    }

    @Override
    public Optional<Question> get(long id) {
        return questionRepository.findById(id);
    }

    @Override
    @Transactional
    public Question insert(NewQuestion fields) {
        validate(fields);
        Question saved = questionRepository.save(QuestionMapper.toEntity(fields));
        log.debug("Stored question {} in category {}", saved.getId(), saved.getCategoryId());
        return saved;
    }

    @Override
    @Transactional
    public boolean delete(long id) {
        if (!questionRepository.existsById(id)) {
            return false;
        }
        questionRepository.deleteById(id);
        return true;
    }

    private void validate(NewQuestion fields) {
        if (fields == null) {
            throw new ValidationException("Question fields are required");
        }
        requireText(fields.questionText(), "question");
        requireText(fields.answer(), "answer");
        if (fields.difficulty() == null) {
            throw new ValidationException("Field 'difficulty' is required");
        }
        if (fields.difficulty() < MIN_DIFFICULTY || fields.difficulty() > MAX_DIFFICULTY) {
            throw new ValidationException("Difficulty must be between %d and %d but was %d"
                    .formatted(MIN_DIFFICULTY, MAX_DIFFICULTY, fields.difficulty()));
        }
        if (fields.categoryId() == null) {
            throw new ValidationException("Field 'category' is required");
        }
        if (!categoryRepository.existsById(fields.categoryId())) {
            throw new ValidationException("Category " + fields.categoryId() + " does not exist");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Field '" + field + "' must not be empty");
        }
    }
}
