package uk.gegc.trivia.features.question.domain.model;

/**
 * Field values for a question that has not been stored yet.
 * Any component may be {@code null}; the store validates them on insert.
 */
public record NewQuestion(
        String questionText,
        String answer,
        Long categoryId,
        Integer difficulty
) {
}
