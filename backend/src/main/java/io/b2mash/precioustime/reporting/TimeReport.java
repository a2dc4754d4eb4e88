package io.b2mash.precioustime.reporting;

import io.b2mash.precioustime.timeentry.TimeEntryWithCategory;
import java.util.List;

public record TimeReport(
    List<TimeEntryWithCategory> entries,
    long totalSeconds,
    List<CategoryBreakdown> categoryBreakdown,
    ReportFilter filter) {}
