package uk.gegc.trivia.features.question.application;

import java.util.List;

/**
 * Slices an ordered listing into fixed-size, 1-based pages.
 */
public final class Paginator {

    private Paginator() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Returns {@code items[(page - 1) * pageSize, page * pageSize)}, or an empty list when
     * the page starts past the end. Input order is preserved.
     */
    public static <T> List<T> paginate(List<T> items, int page, int pageSize) {
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1 but was " + page);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be > 0 but was " + pageSize);
        }
        long start = (long) (page - 1) * pageSize;
        if (start >= items.size()) {
            return List.of();
        }
        int end = (int) Math.min(start + pageSize, items.size());
        return List.copyOf(items.subList((int) start, end));
    }
}
