package io.b2mash.precioustime.reporting;

import io.b2mash.precioustime.config.TrackerProperties;
import io.b2mash.precioustime.tag.TagService;
import io.b2mash.precioustime.timeentry.TimeEntryRepository;
import io.b2mash.precioustime.timeentry.TimeEntryWithCategory;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ReportService {

  private static final Logger log = LoggerFactory.getLogger(ReportService.class);

  static final String UNCATEGORIZED_NAME = "No Category";

  private final TimeEntryRepository timeEntryRepository;
  private final TagService tagService;
  private final TrackerProperties properties;
  private final Clock clock;

  public ReportService(
      TimeEntryRepository timeEntryRepository,
      TagService tagService,
      TrackerProperties properties,
      Clock clock) {
    this.timeEntryRepository = timeEntryRepository;
    this.tagService = tagService;
    this.properties = properties;
    this.clock = clock;
  }

  /** Resolves {@code period} against the current time in the configured zone, then reports. */
  @Transactional(readOnly = true)
  public TimeReport getReport(String period, Long categoryFilter, List<Long> tagIds) {
    var now = ZonedDateTime.ofInstant(clock.instant(), properties.zoneId());
    var range = ReportPeriod.calculate(period, now);
    var filter =
        new ReportFilter(
            range.startInstant(),
            range.endInstant(),
            categoryFilter == null ? ReportFilter.ALL_CATEGORIES : categoryFilter,
            tagIds);
    return getReport(filter);
  }

  @Transactional(readOnly = true)
  public TimeReport getReport(ReportFilter filter) {
    var candidates =
        timeEntryRepository.findForReport(
            filter.startDate(), filter.endDate(), filter.categoryFilter());
    var entries = filterByTags(candidates, filter.tagIds());

    var buckets = new LinkedHashMap<Long, Bucket>();
    long uncategorizedSeconds = 0;
    long totalSeconds = 0;
    for (var entry : entries) {
      long seconds = entry.elapsedSeconds();
      totalSeconds += seconds;
      if (entry.categoryId() == null) {
        uncategorizedSeconds += seconds;
      } else {
        var bucket =
            buckets.computeIfAbsent(
                entry.categoryId(),
                id -> new Bucket(id, entry.categoryName(), entry.categoryColor()));
        bucket.seconds += seconds;
      }
    }

    var breakdown = new ArrayList<CategoryBreakdown>();
    for (var bucket : buckets.values()) {
      breakdown.add(
          new CategoryBreakdown(
              bucket.categoryId,
              bucket.name,
              bucket.color,
              bucket.seconds,
              percentage(bucket.seconds, totalSeconds)));
    }
    if (uncategorizedSeconds > 0) {
      breakdown.add(
          new CategoryBreakdown(
              ReportFilter.UNCATEGORIZED,
              UNCATEGORIZED_NAME,
              properties.uncategorizedColor(),
              uncategorizedSeconds,
              percentage(uncategorizedSeconds, totalSeconds)));
    }

    log.debug(
        "Report {}..{} category={} tags={}: {} entries, {}s",
        filter.startDate(),
        filter.endDate(),
        filter.categoryFilter(),
        filter.tagIds(),
        entries.size(),
        totalSeconds);
    return new TimeReport(entries, totalSeconds, List.copyOf(breakdown), filter);
  }

  /** Keeps entries linked to every requested tag. Links are loaded for all candidates at once. */
  private List<TimeEntryWithCategory> filterByTags(
      List<TimeEntryWithCategory> candidates, List<Long> tagIds) {
    if (tagIds.isEmpty() || candidates.isEmpty()) {
      return candidates;
    }
    var tagsByEntry =
        tagService.tagIdsByEntry(candidates.stream().map(TimeEntryWithCategory::id).toList());
    return candidates.stream()
        .filter(entry -> tagsByEntry.getOrDefault(entry.id(), Set.of()).containsAll(tagIds))
        .toList();
  }

  private static double percentage(long seconds, long totalSeconds) {
    return totalSeconds > 0 ? seconds * 100.0 / totalSeconds : 0.0;
  }

  private static final class Bucket {
    private final long categoryId;
    private final String name;
    private final String color;
    private long seconds;

    private Bucket(long categoryId, String name, String color) {
      this.categoryId = categoryId;
      this.name = name;
      this.color = color;
    }
  }
}
