package uk.gegc.trivia.features.question.infra.mapping;

import uk.gegc.trivia.features.question.api.dto.QuestionDto;
import uk.gegc.trivia.features.question.domain.model.NewQuestion;
import uk.gegc.trivia.features.question.domain.model.Question;

import java.util.List;

public final class QuestionMapper {

    private QuestionMapper() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    public static Question toEntity(NewQuestion fields) {
        Question question = new Question();
        question.setQuestionText(fields.questionText().trim());
        question.setAnswer(fields.answer().trim());
        question.setCategoryId(fields.categoryId());
        question.setDifficulty(fields.difficulty());
        return question;
    }

    public static QuestionDto toDto(Question question) {
        return new QuestionDto(
                question.getId(),
                question.getQuestionText(),
                question.getAnswer(),
                question.getCategoryId(),
                question.getDifficulty()
        );
    }

    public static List<QuestionDto> toDtos(List<Question> questions) {
        return questions.stream().map(QuestionMapper::toDto).toList();
    }
}
