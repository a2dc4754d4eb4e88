package io.b2mash.precioustime.reporting;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.precioustime.config.TrackerProperties;
import io.b2mash.precioustime.tag.TagService;
import io.b2mash.precioustime.timeentry.TimeEntryRepository;
import io.b2mash.precioustime.timeentry.TimeEntryWithCategory;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ReportServiceTest {

  private static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");
  private static final Instant FROM = Instant.parse("2024-01-15T00:00:00Z");
  private static final Instant TO = Instant.parse("2024-01-15T23:59:59Z");

  @Mock private TimeEntryRepository timeEntryRepository;
  @Mock private TagService tagService;

  private ReportService service;

  @BeforeEach
  void setUp() {
    service =
        new ReportService(
            timeEntryRepository,
            tagService,
            new TrackerProperties("UTC", null, null, null, null),
            Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void getReport_sumsClosedEntriesAndBuildsBreakdown() {
    var work = entry(1L, 3600, 10L, "Work", "#ff0000");
    var untagged = entry(2L, 600, null, null, null);
    var play = entry(3L, 2400, 20L, "Play", "#00ff00");
    var running = running(4L, 10L, "Work", "#ff0000");
    when(timeEntryRepository.findForReport(FROM, TO, 0L))
        .thenReturn(List.of(running, work, untagged, play));

    var report = service.getReport(new ReportFilter(FROM, TO, 0L, List.of()));

    assertThat(report.totalSeconds()).isEqualTo(6600);
    assertThat(report.entries()).hasSize(4);
    assertThat(report.categoryBreakdown())
        .extracting(CategoryBreakdown::categoryId, CategoryBreakdown::totalSeconds)
        .containsExactly(tuple(10L, 3600L), tuple(20L, 2400L), tuple(-1L, 600L));
    var noCategory = report.categoryBreakdown().get(2);
    assertThat(noCategory.categoryName()).isEqualTo("No Category");
    assertThat(noCategory.color()).isEqualTo("#888888");
    assertThat(report.categoryBreakdown().stream().mapToDouble(CategoryBreakdown::percentage).sum())
        .isCloseTo(100.0, within(1e-9));
    verify(tagService, never()).tagIdsByEntry(any());
  }

  @Test
  void getReport_tagFilterRequiresEveryTag() {
    var both = entry(1L, 100, null, null, null);
    var onlyOne = entry(2L, 200, null, null, null);
    var none = entry(3L, 300, null, null, null);
    when(timeEntryRepository.findForReport(FROM, TO, 0L)).thenReturn(List.of(both, onlyOne, none));
    when(tagService.tagIdsByEntry(List.of(1L, 2L, 3L)))
        .thenReturn(Map.of(1L, Set.of(7L, 8L, 9L), 2L, Set.of(7L), 3L, Set.of()));

    var report = service.getReport(new ReportFilter(FROM, TO, 0L, List.of(7L, 8L)));

    assertThat(report.entries()).extracting(TimeEntryWithCategory::id).containsExactly(1L);
    assertThat(report.totalSeconds()).isEqualTo(100);
  }

  @Test
  void getReport_onlyRunningEntries_zeroPercentagesAndNoUncategorizedBucket() {
    when(timeEntryRepository.findForReport(FROM, TO, 0L))
        .thenReturn(List.of(running(1L, 10L, "Work", "#ff0000"), running(2L, null, null, null)));

    var report = service.getReport(new ReportFilter(FROM, TO, 0L, null));

    assertThat(report.totalSeconds()).isZero();
    assertThat(report.categoryBreakdown()).hasSize(1);
    assertThat(report.categoryBreakdown().get(0).percentage()).isZero();
  }

  @Test
  void getReport_periodResolvedAgainstClockInConfiguredZone() {
    when(timeEntryRepository.findForReport(eq(FROM), eq(TO), anyLong())).thenReturn(List.of());

    var report = service.getReport("today", -1L, null);

    assertThat(report.filter().startDate()).isEqualTo(FROM);
    assertThat(report.filter().endDate()).isEqualTo(TO);
    assertThat(report.filter().categoryFilter()).isEqualTo(-1L);
    assertThat(report.categoryBreakdown()).isEmpty();
  }

  private static TimeEntryWithCategory entry(
      Long id, long seconds, Long categoryId, String name, String color) {
    var start = NOW.minusSeconds(seconds + 60);
    return new TimeEntryWithCategory(
        id, "entry " + id, start, start.plusSeconds(seconds), categoryId, name, color, start);
  }

  private static TimeEntryWithCategory running(
      Long id, Long categoryId, String name, String color) {
    return new TimeEntryWithCategory(
        id, "running " + id, NOW.minusSeconds(30), null, categoryId, name, color, NOW);
  }
}
