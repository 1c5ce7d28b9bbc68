package uk.gegc.trivia.features.category.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.trivia.features.category.api.dto.CategoryDto;
import uk.gegc.trivia.features.category.application.CategoryCatalog;
import uk.gegc.trivia.features.category.domain.model.Category;
import uk.gegc.trivia.features.category.domain.repository.CategoryRepository;
import uk.gegc.trivia.shared.result.ErrorKind;
import uk.gegc.trivia.shared.result.OperationResult;

import java.util.List;

@Slf4j
@Service
@Transactional(readOnly = true)
@RequiredArgsConstructor
public class CategoryCatalogImpl implements CategoryCatalog {

    private final CategoryRepository categoryRepository;

    @Override
    public OperationResult<List<CategoryDto>> listAll() {
        List<Category> categories = categoryRepository.findAllByOrderByIdAsc();
        if (categories.isEmpty()) {
            log.debug("Category catalog is empty");
            return OperationResult.failure(ErrorKind.NOT_FOUND, "No categories available");
        }
        return OperationResult.success(categories.stream()
                .map(category -> new CategoryDto(category.getId(), category.getType()))
                .toList());
    }

    @Override
    public OperationResult<List<String>> labelsOnly() {
        return listAll().map(categories -> categories.stream()
                .map(CategoryDto::type)
                .toList());
    }
}
