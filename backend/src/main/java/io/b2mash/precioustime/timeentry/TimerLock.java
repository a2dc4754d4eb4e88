package io.b2mash.precioustime.timeentry;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/** The one row that timer starts lock before looking for a running entry. */
@Entity
@Table(name = "timer_lock")
public class TimerLock {

  static final long ID = 1L;

  @Id
  @Column(name = "id")
  private Long id;

  protected TimerLock() {}

  public Long getId() {
    return id;
  }
}
