package uk.gegc.trivia.features.question.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Paginator")
class PaginatorTest {

    private static final List<Integer> TWELVE = IntStream.rangeClosed(1, 12).boxed().toList();

    @Test
    @DisplayName("paginate: first page holds the first pageSize items")
    void paginate_firstPage() {
        assertThat(Paginator.paginate(TWELVE, 1, 10)).containsExactly(1, 2, 3, 4, 5, 6, 7, 8, 9, 10);
    }

    @Test
    @DisplayName("paginate: last page holds the remainder")
    void paginate_lastPartialPage() {
        assertThat(Paginator.paginate(TWELVE, 2, 10)).containsExactly(11, 12);
    }

    @Test
    @DisplayName("paginate: page past the end is empty, not clamped")
    void paginate_beyondEnd_isEmpty() {
        assertThat(Paginator.paginate(TWELVE, 3, 10)).isEmpty();
        assertThat(Paginator.paginate(TWELVE, 1000, 10)).isEmpty();
        assertThat(Paginator.paginate(List.of(), 1, 10)).isEmpty();
    }

    @ParameterizedTest(name = "page={0}, size={1}")
    @CsvSource({"1,1", "2,3", "3,5", "4,4", "1,12", "1,50", "7,2"})
    @DisplayName("paginate: never more than pageSize items and input order kept")
    void paginate_boundedAndOrdered(int page, int size) {
        List<Integer> slice = Paginator.paginate(TWELVE, page, size);

        assertThat(slice).hasSizeLessThanOrEqualTo(size);
        assertThat(slice).isSorted();
        if (!slice.isEmpty()) {
            assertThat(slice.get(0)).isEqualTo((page - 1) * size + 1);
        }
    }

    @Test
    @DisplayName("paginate: same input and page give the same slice")
    void paginate_isDeterministic() {
        assertThat(Paginator.paginate(TWELVE, 2, 5)).isEqualTo(Paginator.paginate(TWELVE, 2, 5));
    }

    @Test
    @DisplayName("paginate: rejects page < 1 and pageSize < 1")
    void paginate_rejectsInvalidArguments() {
        assertThatThrownBy(() -> Paginator.paginate(TWELVE, 0, 10))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Paginator.paginate(TWELVE, 1, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
