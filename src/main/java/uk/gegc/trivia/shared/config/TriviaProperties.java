package uk.gegc.trivia.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for question listing and quiz play.
 */
@Component
@Data
@Validated
@ConfigurationProperties(prefix = "trivia")
public class TriviaProperties {

    public static final int DEFAULT_QUESTIONS_PER_PAGE = 10;

    /**
     * Page size used when a caller does not pass one.
     */
    @Min(value = 1, message = "Property trivia.questions-per-page must be positive")
    private int questionsPerPage = DEFAULT_QUESTIONS_PER_PAGE;

    @Valid
    private Quiz quiz = new Quiz();

    @Data
    public static class Quiz {

        /**
         * Seed for the quiz random source. Unset means a non-deterministic source.
         */
        private Long randomSeed;
    }
}
