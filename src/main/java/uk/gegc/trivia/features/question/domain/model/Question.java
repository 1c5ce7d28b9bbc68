package uk.gegc.trivia.features.question.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "questions")
public class Question {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", updatable = false, nullable = false)
    private Long id;

    @Column(name = "question", nullable = false, length = 1000)
    private String questionText;

    @Column(name = "answer", nullable = false, length = 1000)
    private String answer;

    @Column(name = "category", nullable = false)
    private Long categoryId;

    @Column(name = "difficulty", nullable = false)
    private Integer difficulty;

}
