package uk.gegc.trivia.features.question.application;

import uk.gegc.trivia.features.question.api.dto.*;
import uk.gegc.trivia.shared.result.OperationResult;

public interface QuestionService {

    /**
     * Page of all questions using the configured page size.
     */
    OperationResult<QuestionPage> listQuestionsPage(int page);

    OperationResult<QuestionPage> listQuestionsPage(int page, int pageSize);

    OperationResult<QuestionCreated> createQuestion(CreateQuestionRequest request, int page);

    OperationResult<QuestionSearchResult> searchQuestions(String term);

    OperationResult<QuestionDeleted> deleteQuestion(long questionId, int page);

    OperationResult<CategoryQuestions> listByCategory(long categoryId);
}
