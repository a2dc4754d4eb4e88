package io.b2mash.precioustime.tag.dto;

import io.b2mash.precioustime.tag.Tag;

public record TagResponse(Long id, String name) {

  public static TagResponse from(Tag tag) {
    return new TagResponse(tag.getId(), tag.getName());
  }
}
