package io.b2mash.precioustime.category.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record CategoryRequest(
    @NotBlank String name,
    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "color must be a hex value like #ff0000")
        String color) {}
