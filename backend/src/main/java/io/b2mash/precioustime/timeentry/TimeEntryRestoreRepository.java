package io.b2mash.precioustime.timeentry;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Writes time entries under ids chosen by the caller, which the identity-generated JPA mapping of
 * {@link TimeEntry} cannot do. Used when restoring entries from a CSV file.
 */
@Repository
public class TimeEntryRestoreRepository {

  private static final Logger log = LoggerFactory.getLogger(TimeEntryRestoreRepository.class);

  private final JdbcTemplate jdbcTemplate;

  public TimeEntryRestoreRepository(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /** Inserts a row under {@code id}. Joins the surrounding transaction. */
  public void insertWithId(
      Long id,
      String description,
      Instant startTime,
      Instant endTime,
      Long categoryId,
      Instant createdAt) {
    jdbcTemplate.update(
        """
        INSERT INTO time_entries (id, description, start_time, end_time, category_id, created_at)
        VALUES (?, ?, ?, ?, ?, ?)
        """,
        id,
        description,
        toUtc(startTime),
        toUtc(endTime),
        categoryId,
        toUtc(createdAt));
  }

  /**
   * Restarts id generation at {@code id + 1} when {@code id} lies beyond every stored row, so later
   * generated ids never collide with it. H2 commits the open transaction on this DDL, so callers
   * must invoke it outside one.
   */
  public void advanceIdentityPast(long id) {
    Long maxId =
        jdbcTemplate.queryForObject("SELECT COALESCE(MAX(id), 0) FROM time_entries", Long.class);
    if (maxId != null && id <= maxId) {
      return;
    }

    String product =
        jdbcTemplate.execute(
            (ConnectionCallback<String>) con -> con.getMetaData().getDatabaseProductName());
    if ("PostgreSQL".equals(product)) {
      jdbcTemplate.queryForObject(
          "SELECT setval(pg_get_serial_sequence('time_entries', 'id'), ?, false)",
          Long.class,
          id + 1);
    } else if ("H2".equals(product)) {
      jdbcTemplate.execute("ALTER TABLE time_entries ALTER COLUMN id RESTART WITH " + (id + 1));
    } else {
      throw new IllegalStateException("Cannot restart time entry ids on " + product);
    }
    log.info("Time entry ids now continue after {}", id);
  }

  private static OffsetDateTime toUtc(Instant instant) {
    return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
  }
}
