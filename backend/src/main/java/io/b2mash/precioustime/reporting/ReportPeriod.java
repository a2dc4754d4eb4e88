package io.b2mash.precioustime.reporting;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

/**
 * Inclusive local-time range for a named report period. Both ends are expressed in the zone of the
 * reference instant; the end is the last whole second of the period.
 */
public record ReportPeriod(ZonedDateTime start, ZonedDateTime end) {

  public static final String TODAY = "today";
  public static final String WEEK = "week";
  public static final String MONTH = "month";
  public static final String YEAR = "year";
  public static final String ALL = "all";

  private static final LocalTime END_OF_DAY = LocalTime.of(23, 59, 59);

  /**
   * Resolves {@code keyword} against {@code now}. Weeks start on Monday. A null or unknown keyword
   * means "all": from the Unix epoch to a hundred years after {@code now}.
   */
  public static ReportPeriod calculate(String keyword, ZonedDateTime now) {
    var zone = now.getZone();
    LocalDate today = now.toLocalDate();
    var normalized = keyword == null ? ALL : keyword.trim().toLowerCase(Locale.ROOT);

    return switch (normalized) {
      case TODAY -> between(today, today, now);
      case WEEK -> {
        var monday = today.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        yield between(monday, monday.plusDays(6), now);
      }
      case MONTH ->
          between(today.withDayOfMonth(1), today.with(TemporalAdjusters.lastDayOfMonth()), now);
      case YEAR ->
          between(today.withDayOfYear(1), today.with(TemporalAdjusters.lastDayOfYear()), now);
      default -> new ReportPeriod(Instant.EPOCH.atZone(zone), now.plusYears(100));
    };
  }

  private static ReportPeriod between(LocalDate first, LocalDate last, ZonedDateTime now) {
    var zone = now.getZone();
    return new ReportPeriod(first.atStartOfDay(zone), last.atTime(END_OF_DAY).atZone(zone));
  }

  public Instant startInstant() {
    return start.toInstant();
  }

  public Instant endInstant() {
    return end.toInstant();
  }
}
