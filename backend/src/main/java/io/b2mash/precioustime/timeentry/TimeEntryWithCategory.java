package io.b2mash.precioustime.timeentry;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/** Wide read shape of a time entry with its category's display fields joined in. */
public record TimeEntryWithCategory(
    Long id,
    String description,
    Instant startTime,
    Instant endTime,
    Long categoryId,
    String categoryName,
    String categoryColor,
    Instant createdAt) {

  public boolean isRunning() {
    return endTime == null;
  }

  public EntryState state() {
    return isRunning() ? EntryState.RUNNING : EntryState.CLOSED;
  }

  /** Whole seconds between start and end, truncated toward zero; 0 while running. */
  public long elapsedSeconds() {
    if (endTime == null) {
      return 0;
    }
    return ChronoUnit.SECONDS.between(startTime, endTime);
  }
}
