package uk.gegc.trivia.features.question.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.trivia.features.question.domain.model.Question;

import java.util.List;

@Repository
public interface QuestionRepository extends JpaRepository<Question, Long> {
    List<Question> findAllByOrderByIdAsc();

    List<Question> findAllByCategoryIdOrderByIdAsc(Long categoryId);

    List<Question> findAllByQuestionTextContainingIgnoreCaseOrderByIdAsc(String term);
}
