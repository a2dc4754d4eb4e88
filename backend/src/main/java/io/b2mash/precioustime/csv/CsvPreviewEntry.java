package io.b2mash.precioustime.csv;

import java.time.Instant;

/**
 * What importing one CSV row would do. Change flags are only set for {@link PreviewStatus#UPDATED}
 * rows and name the fields that differ from the stored entry.
 */
public record CsvPreviewEntry(
    int row,
    Long id,
    String description,
    Instant startTime,
    Instant endTime,
    String category,
    PreviewStatus status,
    boolean descriptionChanged,
    boolean startTimeChanged,
    boolean endTimeChanged,
    boolean categoryChanged) {}
