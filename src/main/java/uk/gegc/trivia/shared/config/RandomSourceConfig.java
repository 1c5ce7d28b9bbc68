package uk.gegc.trivia.shared.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * Provides the random source used by quiz selection.
 * A configured seed makes the sequence of picks reproducible.
 */
@Configuration
@Slf4j
public class RandomSourceConfig {

    @Bean
    public Random quizRandom(TriviaProperties triviaProperties) {
        Long seed = triviaProperties.getQuiz().getRandomSeed();
        if (seed == null) {
            return new Random();
        }
        log.info("Quiz random source seeded with {}", seed);
        return new Random(seed);
    }
}
