package io.b2mash.precioustime.category;

import io.b2mash.precioustime.config.TrackerProperties;
import io.b2mash.precioustime.exception.ResourceConflictException;
import io.b2mash.precioustime.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CategoryService {

  private static final Logger log = LoggerFactory.getLogger(CategoryService.class);

  private final CategoryRepository categoryRepository;
  private final TrackerProperties properties;
  private final Clock clock;

  public CategoryService(
      CategoryRepository categoryRepository, TrackerProperties properties, Clock clock) {
    this.categoryRepository = categoryRepository;
    this.properties = properties;
    this.clock = clock;
  }

  @Transactional(readOnly = true)
  public List<Category> listCategories() {
    return categoryRepository.findByOrderByNameAsc();
  }

  @Transactional(readOnly = true)
  public Category getCategory(Long id) {
    return categoryRepository
        .findById(id)
        .orElseThrow(() -> new ResourceNotFoundException("Category", id));
  }

  @Transactional(readOnly = true)
  public void requireExists(Long id) {
    if (id != null && !categoryRepository.existsById(id)) {
      throw new ResourceNotFoundException("Category", id);
    }
  }

  @Transactional
  public Category createCategory(String name, String color) {
    var trimmed = name.trim();
    if (categoryRepository.findByName(trimmed).isPresent()) {
      throw ResourceConflictException.duplicateName("Category", trimmed);
    }
    var category = categoryRepository.save(new Category(trimmed, colorOrDefault(color), now()));
    log.info("Created category: id={}, name={}", category.getId(), category.getName());
    return category;
  }

  @Transactional
  public Category updateCategory(Long id, String name, String color) {
    var category = getCategory(id);
    var trimmed = name.trim();
    categoryRepository
        .findByName(trimmed)
        .filter(other -> !other.getId().equals(id))
        .ifPresent(
            other -> {
              throw ResourceConflictException.duplicateName("Category", trimmed);
            });

    category.rename(trimmed, colorOrDefault(color));
    category = categoryRepository.save(category);
    log.info("Updated category: id={}, name={}", category.getId(), category.getName());
    return category;
  }

  /** Deletes a category. Entries that referenced it become uncategorized; none are deleted. */
  @Transactional
  public void deleteCategory(Long id) {
    var category = getCategory(id);
    int detached = categoryRepository.detachTimeEntries(id);
    categoryRepository.deleteById(category.getId());
    log.info(
        "Deleted category: id={}, name={}, detachedEntries={}", id, category.getName(), detached);
  }

  /**
   * Resolves a category by exact name, creating it with the default color when absent. Joins the
   * caller's transaction.
   */
  @Transactional
  public Category getOrCreateByName(String name) {
    return categoryRepository
        .findByName(name)
        .orElseGet(
            () -> {
              var created =
                  categoryRepository.save(
                      new Category(name, properties.defaultCategoryColor(), now()));
              log.info("Created category '{}' with default color during import", name);
              return created;
            });
  }

  private String colorOrDefault(String color) {
    return color == null || color.isBlank() ? properties.defaultCategoryColor() : color;
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.SECONDS);
  }
}
