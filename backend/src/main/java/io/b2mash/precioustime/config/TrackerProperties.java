package io.b2mash.precioustime.config;

import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tracker settings bound from {@code tracker.*}. A blank {@code zone} falls back to the JVM default
 * zone, which is the "local clock" used for report period boundaries and CSV rendering.
 */
@ConfigurationProperties("tracker")
public record TrackerProperties(
    String zone,
    String defaultCategoryColor,
    String uncategorizedColor,
    Integer recentEntriesLimit,
    Csv csv) {

  public TrackerProperties {
    if (defaultCategoryColor == null || defaultCategoryColor.isBlank()) {
      defaultCategoryColor = "#cccccc";
    }
    if (uncategorizedColor == null || uncategorizedColor.isBlank()) {
      uncategorizedColor = "#888888";
    }
    if (recentEntriesLimit == null || recentEntriesLimit <= 0) {
      recentEntriesLimit = 50;
    }
    if (csv == null) {
      csv = new Csv(null);
    }
  }

  public ZoneId zoneId() {
    return zone == null || zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
  }

  /** CSV import settings. Naive timestamps (no offset) are read in {@code naiveZone}. */
  public record Csv(String naiveZone) {

    public ZoneId naiveZoneId() {
      return naiveZone == null || naiveZone.isBlank() ? ZoneId.of("UTC") : ZoneId.of(naiveZone);
    }
  }
}
