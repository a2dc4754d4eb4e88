package io.b2mash.precioustime.csv;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Optional;

/**
 * Reads CSV timestamps. An ISO-8601 value with an offset is taken as is; otherwise a series of
 * naive layouts is tried and the result is placed in the configured zone.
 */
public class FlexibleTimestampParser {

  private static final List<DateTimeFormatter> NAIVE_DATE_TIMES =
      List.of(
          strict("uuuu-MM-dd HH:mm:ss"),
          strict("uuuu-MM-dd'T'HH:mm:ss"),
          strict("uuuu-MM-dd HH:mm"),
          strict("uuuu-MM-dd'T'HH:mm"));

  private static final DateTimeFormatter DATE_ONLY = strict("uuuu-MM-dd");

  private final ZoneId naiveZone;

  public FlexibleTimestampParser(ZoneId naiveZone) {
    this.naiveZone = naiveZone;
  }

  /** Returns the parsed instant, or empty when {@code value} is blank or matches no layout. */
  public Optional<Instant> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    var text = value.trim();

    try {
      return Optional.of(
          OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant());
    } catch (DateTimeParseException ignored) {
      // fall through to the naive layouts
    }
    for (var formatter : NAIVE_DATE_TIMES) {
      try {
        return Optional.of(LocalDateTime.parse(text, formatter).atZone(naiveZone).toInstant());
      } catch (DateTimeParseException ignored) {
        // next layout
      }
    }
    try {
      return Optional.of(LocalDate.parse(text, DATE_ONLY).atStartOfDay(naiveZone).toInstant());
    } catch (DateTimeParseException ignored) {
      return Optional.empty();
    }
  }

  private static DateTimeFormatter strict(String pattern) {
    return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
  }
}
