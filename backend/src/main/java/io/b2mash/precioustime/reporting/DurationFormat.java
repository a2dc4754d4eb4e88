package io.b2mash.precioustime.reporting;

/** Short human readable durations: "12m 5s" below an hour, "3h 20m" from an hour on. */
public final class DurationFormat {

  private DurationFormat() {}

  public static String ofSeconds(long seconds) {
    if (seconds < 3600) {
      return "%dm %ds".formatted(seconds / 60, seconds % 60);
    }
    return "%dh %dm".formatted(seconds / 3600, (seconds % 3600) / 60);
  }
}
