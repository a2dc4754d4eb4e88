package io.b2mash.precioustime.reporting;

import io.b2mash.precioustime.timeentry.TimeEntryController.TimeEntryResponse;
import java.time.Instant;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reports")
public class ReportController {

  private final ReportService reportService;

  public ReportController(ReportService reportService) {
    this.reportService = reportService;
  }

  @GetMapping
  public ResponseEntity<ReportResponse> getReport(
      @RequestParam(defaultValue = ReportPeriod.TODAY) String period,
      @RequestParam(defaultValue = "0") Long categoryId,
      @RequestParam(required = false) List<Long> tagIds) {
    var report = reportService.getReport(period, categoryId, tagIds);
    return ResponseEntity.ok(ReportResponse.from(period, report));
  }

  // --- DTOs ---

  public record ReportResponse(
      String period,
      Instant startDate,
      Instant endDate,
      long categoryId,
      List<Long> tagIds,
      long totalSeconds,
      String totalFormatted,
      List<BreakdownResponse> categoryBreakdown,
      List<TimeEntryResponse> entries) {

    static ReportResponse from(String period, TimeReport report) {
      var filter = report.filter();
      return new ReportResponse(
          period,
          filter.startDate(),
          filter.endDate(),
          filter.categoryFilter(),
          filter.tagIds(),
          report.totalSeconds(),
          DurationFormat.ofSeconds(report.totalSeconds()),
          report.categoryBreakdown().stream().map(BreakdownResponse::from).toList(),
          report.entries().stream().map(TimeEntryResponse::from).toList());
    }
  }

  public record BreakdownResponse(
      long categoryId,
      String categoryName,
      String color,
      long totalSeconds,
      String totalFormatted,
      double percentage) {

    static BreakdownResponse from(CategoryBreakdown breakdown) {
      return new BreakdownResponse(
          breakdown.categoryId(),
          breakdown.categoryName(),
          breakdown.color(),
          breakdown.totalSeconds(),
          DurationFormat.ofSeconds(breakdown.totalSeconds()),
          breakdown.percentage());
    }
  }
}
