package io.b2mash.precioustime.tag;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/** Link between a time entry and a tag. Removed by cascade when either side is deleted. */
@Entity
@Table(name = "time_entry_tags")
public class TimeEntryTag {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "time_entry_id", nullable = false, updatable = false)
  private Long timeEntryId;

  @Column(name = "tag_id", nullable = false, updatable = false)
  private Long tagId;

  protected TimeEntryTag() {}

  public TimeEntryTag(Long timeEntryId, Long tagId) {
    this.timeEntryId = timeEntryId;
    this.tagId = tagId;
  }

  public Long getId() {
    return id;
  }

  public Long getTimeEntryId() {
    return timeEntryId;
  }

  public Long getTagId() {
    return tagId;
  }
}
