package io.b2mash.precioustime.timeentry;

import io.b2mash.precioustime.exception.ValidationFailureException;
import io.b2mash.precioustime.tag.TagExtractor;
import io.b2mash.precioustime.tag.TagService;
import io.b2mash.precioustime.tag.dto.TagResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/time-entries")
public class TimeEntryController {

  private final TimeEntryService timeEntryService;
  private final TagService tagService;

  public TimeEntryController(TimeEntryService timeEntryService, TagService tagService) {
    this.timeEntryService = timeEntryService;
    this.tagService = tagService;
  }

  @PostMapping("/start")
  public ResponseEntity<TimeEntryResponse> start(
      @Valid @RequestBody(required = false) StartTimerRequest request) {
    var entry =
        request == null
            ? timeEntryService.start(null, null)
            : timeEntryService.start(request.description(), request.categoryId());
    return ResponseEntity.created(URI.create("/api/time-entries/" + entry.id()))
        .body(TimeEntryResponse.from(entry));
  }

  @PostMapping("/stop")
  public ResponseEntity<TimeEntryResponse> stop() {
    return timeEntryService
        .stop()
        .map(entry -> ResponseEntity.ok(TimeEntryResponse.from(entry)))
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @GetMapping
  public ResponseEntity<List<TimeEntryResponse>> listRecent() {
    return ResponseEntity.ok(
        timeEntryService.listRecentTimeEntries().stream().map(TimeEntryResponse::from).toList());
  }

  @GetMapping("/active")
  public ResponseEntity<TimeEntryResponse> getActive() {
    return timeEntryService
        .getActiveTimeEntry()
        .map(entry -> ResponseEntity.ok(TimeEntryResponse.from(entry)))
        .orElseGet(() -> ResponseEntity.noContent().build());
  }

  @PatchMapping("/active")
  public ResponseEntity<TimeEntryResponse> updateActive(
      @Valid @RequestBody UpdateActiveEntryRequest request) {
    return ResponseEntity.ok(
        TimeEntryResponse.from(
            timeEntryService.updateActiveEntry(request.description(), request.categoryId())));
  }

  @GetMapping("/{id}")
  public ResponseEntity<TimeEntryResponse> get(@PathVariable Long id) {
    return ResponseEntity.ok(TimeEntryResponse.from(timeEntryService.getTimeEntry(id)));
  }

  @GetMapping("/{id}/tags")
  public ResponseEntity<List<TagResponse>> listTags(@PathVariable Long id) {
    timeEntryService.getTimeEntry(id);
    return ResponseEntity.ok(tagService.listForEntry(id));
  }

  @PutMapping("/{id}")
  public ResponseEntity<TimeEntryResponse> update(
      @PathVariable Long id, @Valid @RequestBody UpdateTimeEntryRequest request) {
    if (request.endTime() != null && !request.endTime().isAfter(request.startTime())) {
      throw new ValidationFailureException(
          "Invalid time range",
          "End time must be after start time",
          request.endTime().toString());
    }
    var entry =
        timeEntryService.updateTimeEntry(
            id,
            request.description(),
            request.startTime(),
            request.endTime(),
            request.categoryId());
    return ResponseEntity.ok(TimeEntryResponse.from(entry));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable Long id) {
    timeEntryService.deleteTimeEntry(id);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record StartTimerRequest(String description, Long categoryId) {}

  public record UpdateActiveEntryRequest(String description, Long categoryId) {}

  public record UpdateTimeEntryRequest(
      @NotNull(message = "description is required") String description,
      @NotNull(message = "startTime is required") Instant startTime,
      Instant endTime,
      Long categoryId) {}

  public record TimeEntryResponse(
      Long id,
      String description,
      Instant startTime,
      Instant endTime,
      EntryState state,
      long durationSeconds,
      Long categoryId,
      String categoryName,
      String categoryColor,
      List<String> tags,
      Instant createdAt) {

    public static TimeEntryResponse from(TimeEntryWithCategory entry) {
      return new TimeEntryResponse(
          entry.id(),
          entry.description(),
          entry.startTime(),
          entry.endTime(),
          entry.state(),
          entry.elapsedSeconds(),
          entry.categoryId(),
          entry.categoryName(),
          entry.categoryColor(),
          TagExtractor.extract(entry.description()),
          entry.createdAt());
    }
  }
}
