package io.b2mash.precioustime.reporting;

/** Time spent in one category. The uncategorized bucket uses category id -1. */
public record CategoryBreakdown(
    long categoryId, String categoryName, String color, long totalSeconds, double percentage) {}
