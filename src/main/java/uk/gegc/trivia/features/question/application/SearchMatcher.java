package uk.gegc.trivia.features.question.application;

import uk.gegc.trivia.features.question.domain.model.Question;

import java.util.List;
import java.util.Locale;

public final class SearchMatcher {

    private SearchMatcher() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Keeps the questions whose text contains {@code term}, ignoring case, in input order.
     * An empty or {@code null} term keeps everything.
     */
    public static List<Question> search(List<Question> items, String term) {
        if (term == null || term.isEmpty()) {
            return List.copyOf(items);
        }
        String needle = term.toLowerCase(Locale.ROOT);
        return items.stream()
                .filter(question -> question.getQuestionText() != null
                        && question.getQuestionText().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }
}
