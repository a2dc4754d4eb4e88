package io.b2mash.precioustime.timeentry;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * Narrow row shape of a tracked activity. Category display fields are not carried here; see
 * {@link TimeEntryWithCategory} for the joined read shape.
 */
@Entity
@Table(name = "time_entries")
public class TimeEntry {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "description", nullable = false)
  private String description;

  @Column(name = "start_time", nullable = false)
  private Instant startTime;

  @Column(name = "end_time")
  private Instant endTime;

  @Column(name = "category_id")
  private Long categoryId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected TimeEntry() {}

  public TimeEntry(
      String description, Instant startTime, Instant endTime, Long categoryId, Instant createdAt) {
    this.description = description;
    this.startTime = startTime;
    this.endTime = endTime;
    this.categoryId = categoryId;
    this.createdAt = createdAt;
  }

  public static TimeEntry running(
      String description, Instant startTime, Long categoryId, Instant createdAt) {
    return new TimeEntry(description, startTime, null, categoryId, createdAt);
  }

  public Long getId() {
    return id;
  }

  public String getDescription() {
    return description;
  }

  public Instant getStartTime() {
    return startTime;
  }

  public Instant getEndTime() {
    return endTime;
  }

  public Long getCategoryId() {
    return categoryId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public EntryState getState() {
    return endTime == null ? EntryState.RUNNING : EntryState.CLOSED;
  }

  public boolean isRunning() {
    return endTime == null;
  }

  public void close(Instant endTime) {
    this.endTime = endTime;
  }

  /**
   * Replaces every mutable field. No ordering check between start and end; a null end reopens the
   * entry.
   */
  public void overwrite(String description, Instant startTime, Instant endTime, Long categoryId) {
    this.description = description;
    this.startTime = startTime;
    this.endTime = endTime;
    this.categoryId = categoryId;
  }

  public void describe(String description, Long categoryId) {
    this.description = description;
    this.categoryId = categoryId;
  }
}
