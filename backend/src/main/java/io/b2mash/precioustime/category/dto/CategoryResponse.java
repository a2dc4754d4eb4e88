package io.b2mash.precioustime.category.dto;

import io.b2mash.precioustime.category.Category;
import java.time.Instant;

public record CategoryResponse(Long id, String name, String color, Instant createdAt) {

  public static CategoryResponse from(Category category) {
    return new CategoryResponse(
        category.getId(), category.getName(), category.getColor(), category.getCreatedAt());
  }
}
