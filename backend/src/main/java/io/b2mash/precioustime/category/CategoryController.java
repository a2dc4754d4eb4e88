package io.b2mash.precioustime.category;

import io.b2mash.precioustime.category.dto.CategoryRequest;
import io.b2mash.precioustime.category.dto.CategoryResponse;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/categories")
public class CategoryController {

  private final CategoryService categoryService;

  public CategoryController(CategoryService categoryService) {
    this.categoryService = categoryService;
  }

  @GetMapping
  public ResponseEntity<List<CategoryResponse>> list() {
    return ResponseEntity.ok(
        categoryService.listCategories().stream().map(CategoryResponse::from).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<CategoryResponse> get(@PathVariable Long id) {
    return ResponseEntity.ok(CategoryResponse.from(categoryService.getCategory(id)));
  }

  @PostMapping
  public ResponseEntity<CategoryResponse> create(@Valid @RequestBody CategoryRequest request) {
    var category = categoryService.createCategory(request.name(), request.color());
    return ResponseEntity.created(URI.create("/api/categories/" + category.getId()))
        .body(CategoryResponse.from(category));
  }

  @PutMapping("/{id}")
  public ResponseEntity<CategoryResponse> update(
      @PathVariable Long id, @Valid @RequestBody CategoryRequest request) {
    return ResponseEntity.ok(
        CategoryResponse.from(categoryService.updateCategory(id, request.name(), request.color())));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable Long id) {
    categoryService.deleteCategory(id);
    return ResponseEntity.noContent().build();
  }
}
