package io.b2mash.precioustime.csv;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class FlexibleTimestampParserTest {

  private final FlexibleTimestampParser utc = new FlexibleTimestampParser(ZoneOffset.UTC);

  @Test
  void parse_offsetDateTime_keepsOffset() {
    assertThat(utc.parse("2025-01-01T10:00:00+09:00"))
        .contains(Instant.parse("2025-01-01T01:00:00Z"));
    assertThat(utc.parse("2025-01-01T10:00:00Z")).contains(Instant.parse("2025-01-01T10:00:00Z"));
    assertThat(utc.parse("2025-01-01T10:00:00.250Z"))
        .contains(Instant.parse("2025-01-01T10:00:00.250Z"));
  }

  @Test
  void parse_naiveLayouts() {
    var expected = Instant.parse("2025-03-04T05:06:07Z");
    assertThat(utc.parse("2025-03-04 05:06:07")).contains(expected);
    assertThat(utc.parse("2025-03-04T05:06:07")).contains(expected);
    assertThat(utc.parse("2025-03-04 05:06")).contains(Instant.parse("2025-03-04T05:06:00Z"));
    assertThat(utc.parse("2025-03-04T05:06")).contains(Instant.parse("2025-03-04T05:06:00Z"));
    assertThat(utc.parse("2025-03-04")).contains(Instant.parse("2025-03-04T00:00:00Z"));
  }

  @Test
  void parse_naiveValue_usesConfiguredZone() {
    var berlin = new FlexibleTimestampParser(ZoneId.of("Europe/Berlin"));

    assertThat(berlin.parse("2025-01-01 10:00:00")).contains(Instant.parse("2025-01-01T09:00:00Z"));
    assertThat(berlin.parse("2025-01-01T10:00:00+00:00"))
        .contains(Instant.parse("2025-01-01T10:00:00Z"));
  }

  @Test
  void parse_trimsWhitespace() {
    assertThat(utc.parse("  2025-03-04  ")).contains(Instant.parse("2025-03-04T00:00:00Z"));
  }

  @Test
  void parse_unrecognized_returnsEmpty() {
    assertThat(utc.parse("not-a-date")).isEmpty();
    assertThat(utc.parse("04/03/2025")).isEmpty();
    assertThat(utc.parse("2025-02-30")).isEmpty();
    assertThat(utc.parse("")).isEmpty();
    assertThat(utc.parse(null)).isEmpty();
  }
}
