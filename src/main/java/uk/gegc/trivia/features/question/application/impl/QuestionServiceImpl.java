package uk.gegc.trivia.features.question.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.trivia.features.category.application.CategoryCatalog;
import uk.gegc.trivia.features.question.api.dto.*;
import uk.gegc.trivia.features.question.application.Paginator;
import uk.gegc.trivia.features.question.application.QuestionService;
import uk.gegc.trivia.features.question.application.QuestionStore;
import uk.gegc.trivia.features.question.application.SearchMatcher;
import uk.gegc.trivia.features.question.domain.model.NewQuestion;
import uk.gegc.trivia.features.question.domain.model.Question;
import uk.gegc.trivia.features.question.infra.mapping.QuestionMapper;
import uk.gegc.trivia.shared.config.TriviaProperties;
import uk.gegc.trivia.shared.result.ErrorKind;
import uk.gegc.trivia.shared.result.OperationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Question listing, search, creation and deletion over a {@link QuestionStore} snapshot.
 *
 * <p>Must stay non-transactional: each store write commits on its own and a failed
 * write is reported as {@code UNPROCESSABLE_ENTITY}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QuestionServiceImpl implements QuestionService {

    private final QuestionStore questionStore;
    private final CategoryCatalog categoryCatalog;
    private final TriviaProperties triviaProperties;

    @Override
    public OperationResult<QuestionPage> listQuestionsPage(int page) {
        return listQuestionsPage(page, triviaProperties.getQuestionsPerPage());
    }

    @Override
    public OperationResult<QuestionPage> listQuestionsPage(int page, int pageSize) {
        if (page < 1 || pageSize < 1) {
            return OperationResult.failure(ErrorKind.INVALID_REQUEST,
                    "Page must be >= 1 and page size > 0 (page=%d, size=%d)".formatted(page, pageSize));
        }

        List<Question> questions = questionStore.listAll();
        List<QuestionDto> current = Paginator.paginate(QuestionMapper.toDtos(questions), page, pageSize);
        if (current.isEmpty()) {
            log.debug("Page {} (size {}) is empty, {} questions stored", page, pageSize, questions.size());
            return OperationResult.failure(ErrorKind.NOT_FOUND, "No questions on page " + page);
        }

        List<String> categories = categoryCatalog.labelsOnly().orElse(List.of());
        return OperationResult.success(new QuestionPage(current, questions.size(), categories, null));
    }

    @Override
    public OperationResult<QuestionCreated> createQuestion(CreateQuestionRequest request, int page) {
        List<String> missing = missingFields(request);
        if (!missing.isEmpty()) {
            return OperationResult.failure(ErrorKind.INVALID_REQUEST, "Missing required fields: " + missing);
        }
        if (page < 1) {
            return OperationResult.failure(ErrorKind.INVALID_REQUEST, "Page must be >= 1 but was " + page);
        }

        Question created;
        try {
            created = questionStore.insert(new NewQuestion(
                    request.question(),
                    request.answer(),
                    request.category(),
                    request.difficulty()
            ));
        } catch (RuntimeException ex) {
            log.warn("Could not create question in category {}: {}", request.category(), ex.getMessage());
            return OperationResult.failure(ErrorKind.UNPROCESSABLE_ENTITY);
        }
        log.info("Created question {} in category {}", created.getId(), created.getCategoryId());

        List<QuestionDto> current = currentPage(page);
        return OperationResult.success(new QuestionCreated(created.getId(), created.getQuestionText(), current));
    }

    @Override
    public OperationResult<QuestionSearchResult> searchQuestions(String term) {
        if (term == null) {
            return OperationResult.failure(ErrorKind.INVALID_REQUEST, "A search term is required");
        }

        List<Question> matches = SearchMatcher.search(questionStore.listAll(), term);
        if (matches.isEmpty()) {
            log.debug("No question matches '{}'", term);
            return OperationResult.failure(ErrorKind.NOT_FOUND, "No questions match '" + term + "'");
        }
        return OperationResult.success(new QuestionSearchResult(QuestionMapper.toDtos(matches), matches.size(), null));
    }

    @Override
    public OperationResult<QuestionDeleted> deleteQuestion(long questionId, int page) {
        if (page < 1) {
            return OperationResult.failure(ErrorKind.INVALID_REQUEST, "Page must be >= 1 but was " + page);
        }
        if (questionStore.get(questionId).isEmpty()) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "Question " + questionId + " not found");
        }

        boolean removed;
        try {
            removed = questionStore.delete(questionId);
        } catch (RuntimeException ex) {
            log.warn("Could not delete question {}: {}", questionId, ex.getMessage());
            return OperationResult.failure(ErrorKind.UNPROCESSABLE_ENTITY);
        }
        if (!removed) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "Question " + questionId + " not found");
        }
        log.info("Deleted question {}", questionId);

        return OperationResult.success(new QuestionDeleted(questionId, currentPage(page)));
    }

    @Override
    public OperationResult<CategoryQuestions> listByCategory(long categoryId) {
        List<Question> questions = questionStore.findByCategory(categoryId);
        // unknown and empty categories both land here
        if (questions.isEmpty()) {
            return OperationResult.failure(ErrorKind.NOT_FOUND, "No questions in category " + categoryId);
        }
        return OperationResult.success(new CategoryQuestions(
                QuestionMapper.toDtos(questions),
                questions.size(),
                String.valueOf(categoryId)
        ));
    }

    private List<QuestionDto> currentPage(int page) {
        return Paginator.paginate(
                QuestionMapper.toDtos(questionStore.listAll()),
                page,
                triviaProperties.getQuestionsPerPage()
        );
    }

    private static List<String> missingFields(CreateQuestionRequest request) {
        List<String> missing = new ArrayList<>();
        if (request == null) {
            return List.of("question", "answer", "category", "difficulty");
        }
        if (request.question() == null) {
            missing.add("question");
        }
        if (request.answer() == null) {
            missing.add("answer");
        }
        if (request.category() == null) {
            missing.add("category");
        }
        if (request.difficulty() == null) {
            missing.add("difficulty");
        }
        return missing;
    }
}
