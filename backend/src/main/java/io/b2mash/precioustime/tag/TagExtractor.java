package io.b2mash.precioustime.tag;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Pulls hashtags out of free-text descriptions. A tag is {@code #} followed by letters, digits or
 * underscores; any other character ends it, so {@code #not-a-tag} yields {@code not}.
 */
public final class TagExtractor {

  private static final Pattern TAG_PATTERN = Pattern.compile("#([A-Za-z0-9_]+)");

  private TagExtractor() {}

  /** Returns lowercase tag names, deduplicated case-insensitively, in first-occurrence order. */
  public static List<String> extract(String description) {
    if (description == null || description.isEmpty()) {
      return List.of();
    }
    var names = new LinkedHashSet<String>();
    var matcher = TAG_PATTERN.matcher(description);
    while (matcher.find()) {
      names.add(matcher.group(1).toLowerCase(Locale.ROOT));
    }
    return List.copyOf(names);
  }
}
