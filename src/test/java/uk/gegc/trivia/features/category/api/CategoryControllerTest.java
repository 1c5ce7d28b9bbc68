package uk.gegc.trivia.features.category.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.trivia.features.category.api.dto.CategoryDto;
import uk.gegc.trivia.features.category.application.CategoryCatalog;
import uk.gegc.trivia.features.question.api.dto.CategoryQuestions;
import uk.gegc.trivia.features.question.api.dto.QuestionDto;
import uk.gegc.trivia.features.question.application.QuestionService;
import uk.gegc.trivia.shared.result.ErrorKind;
import uk.gegc.trivia.shared.result.OperationResult;

import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CategoryController.class)
class CategoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CategoryCatalog categoryCatalog;

    @MockitoBean
    private QuestionService questionService;

    @Test
    @DisplayName("GET /api/v1/categories returns labels keyed by id")
    void getCategories_success() throws Exception {
        when(categoryCatalog.listAll()).thenReturn(OperationResult.success(List.of(
                new CategoryDto(1L, "Science"),
                new CategoryDto(2L, "Art")
        )));

        mockMvc.perform(get("/api/v1/categories"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.categories.1", is("Science")))
                .andExpect(jsonPath("$.categories.2", is("Art")));
    }

    @Test
    @DisplayName("GET /api/v1/categories with an empty catalog returns 404")
    void getCategories_empty() throws Exception {
        when(categoryCatalog.listAll()).thenReturn(OperationResult.failure(ErrorKind.NOT_FOUND, "No categories available"));

        mockMvc.perform(get("/api/v1/categories"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success", is(false)))
                .andExpect(jsonPath("$.message", is("No categories available")));
    }

    @Test
    @DisplayName("GET /api/v1/categories/{id}/questions returns the category's questions")
    void getQuestionsByCategory_success() throws Exception {
        QuestionDto question = new QuestionDto(10L, "The Taj Mahal is located in which Indian city?", "Agra", 3L, 2);
        when(questionService.listByCategory(3L))
                .thenReturn(OperationResult.success(new CategoryQuestions(List.of(question), 1, "3")));

        mockMvc.perform(get("/api/v1/categories/{id}/questions", 3))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success", is(true)))
                .andExpect(jsonPath("$.questions", hasSize(1)))
                .andExpect(jsonPath("$.total_questions", is(1)))
                .andExpect(jsonPath("$.current_category", is("3")));
    }

    @Test
    @DisplayName("GET /api/v1/categories/{id}/questions for an empty category returns 404")
    void getQuestionsByCategory_notFound() throws Exception {
        when(questionService.listByCategory(1000L)).thenReturn(OperationResult.failure(ErrorKind.NOT_FOUND));

        mockMvc.perform(get("/api/v1/categories/{id}/questions", 1000))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success", is(false)));
    }

    @Test
    @DisplayName("GET on an unknown route returns 404 with success=false")
    void unknownRoute() throws Exception {
        mockMvc.perform(get("/api/v1/category"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success", is(false)));
    }
}
