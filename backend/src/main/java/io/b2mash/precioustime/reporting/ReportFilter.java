package io.b2mash.precioustime.reporting;

import java.time.Instant;
import java.util.List;

/**
 * Report selection. {@code categoryFilter} is 0 for every category, -1 for uncategorized entries
 * only, or a category id. Non-empty {@code tagIds} keep only entries carrying all of them.
 */
public record ReportFilter(
    Instant startDate, Instant endDate, long categoryFilter, List<Long> tagIds) {

  public static final long ALL_CATEGORIES = 0L;
  public static final long UNCATEGORIZED = -1L;

  public ReportFilter {
    tagIds = tagIds == null ? List.of() : List.copyOf(tagIds);
  }
}
