package uk.gegc.trivia.features.category.application;

import uk.gegc.trivia.features.category.api.dto.CategoryDto;
import uk.gegc.trivia.shared.result.OperationResult;

import java.util.List;

/**
 * Read-only view of the category catalog.
 *
 * <p>An empty catalog is reported as {@code NOT_FOUND} rather than as an empty list.
 */
public interface CategoryCatalog {

    OperationResult<List<CategoryDto>> listAll();

    /**
     * Category labels in listing order, without ids.
     */
    OperationResult<List<String>> labelsOnly();
}
