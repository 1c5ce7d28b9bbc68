package uk.gegc.trivia.shared.result;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.trivia.shared.exception.TriviaOperationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OperationResult")
class OperationResultTest {

    @Test
    @DisplayName("success: map transforms the value")
    void success_map() {
        OperationResult<Integer> result = OperationResult.success("trivia").map(String::length);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.orElseThrow()).isEqualTo(6);
        assertThat(result.errorKind()).isEmpty();
    }

    @Test
    @DisplayName("failure: map and flatMap keep kind and message")
    void failure_mapKeepsKind() {
        OperationResult<String> failure = OperationResult.failure(ErrorKind.NOT_FOUND, "nothing here");

        OperationResult<Integer> mapped = failure.map(String::length);
        OperationResult<Integer> flatMapped = failure.flatMap(value -> OperationResult.success(1));

        assertThat(mapped).isEqualTo(new OperationResult.Failure<Integer>(ErrorKind.NOT_FOUND, "nothing here"));
        assertThat(flatMapped.errorKind()).contains(ErrorKind.NOT_FOUND);
    }

    @Test
    @DisplayName("failure: orElse returns the fallback")
    void failure_orElse() {
        OperationResult<String> failure = OperationResult.failure(ErrorKind.UNPROCESSABLE_ENTITY);

        assertThat(failure.orElse("fallback")).isEqualTo("fallback");
    }

    @Test
    @DisplayName("failure: orElseThrow raises with the same kind")
    void failure_orElseThrow() {
        OperationResult<String> failure = OperationResult.failure(ErrorKind.INVALID_REQUEST, "missing answer");

        assertThatThrownBy(failure::orElseThrow)
                .isInstanceOf(TriviaOperationException.class)
                .hasMessage("missing answer")
                .extracting(ex -> ((TriviaOperationException) ex).getKind())
                .isEqualTo(ErrorKind.INVALID_REQUEST);
    }

    @Test
    @DisplayName("failure: blank message falls back to the kind default")
    void failure_defaultMessage() {
        OperationResult.Failure<String> failure = new OperationResult.Failure<>(ErrorKind.NOT_FOUND, " ");

        assertThat(failure.message()).isEqualTo(ErrorKind.NOT_FOUND.getDefaultMessage());
    }
}
