package io.b2mash.precioustime.timeentry;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TimeEntryRepository extends JpaRepository<TimeEntry, Long> {

  String WITH_CATEGORY =
      """
      SELECT new io.b2mash.precioustime.timeentry.TimeEntryWithCategory(
          te.id, te.description, te.startTime, te.endTime, te.categoryId,
          c.name, c.color, te.createdAt)
      FROM TimeEntry te LEFT JOIN Category c ON c.id = te.categoryId
      """;

  /** Entries without an end time, most recent first. Normally at most one. */
  @Query("SELECT te FROM TimeEntry te WHERE te.endTime IS NULL ORDER BY te.startTime DESC")
  List<TimeEntry> findRunning();

  @Query(WITH_CATEGORY + " WHERE te.endTime IS NULL ORDER BY te.startTime DESC")
  List<TimeEntryWithCategory> findRunningWithCategory();

  @Query(WITH_CATEGORY + " WHERE te.id = :id")
  Optional<TimeEntryWithCategory> findWithCategoryById(@Param("id") Long id);

  @Query(WITH_CATEGORY + " ORDER BY te.startTime DESC, te.id DESC")
  List<TimeEntryWithCategory> findRecentWithCategory(Pageable pageable);

  @Query(WITH_CATEGORY + " ORDER BY te.startTime ASC, te.id ASC")
  List<TimeEntryWithCategory> findAllWithCategory();

  /**
   * Entries whose start falls within {@code [startDate, endDate]}. {@code categoryFilter} 0 matches
   * every entry, -1 only uncategorized entries, and a positive value that category.
   */
  @Query(
      WITH_CATEGORY
          + """
          WHERE te.startTime >= :startDate
            AND te.startTime <= :endDate
            AND (:categoryFilter = 0L
                 OR (:categoryFilter = -1L AND te.categoryId IS NULL)
                 OR te.categoryId = :categoryFilter)
          ORDER BY te.startTime DESC, te.id DESC
          """)
  List<TimeEntryWithCategory> findForReport(
      @Param("startDate") Instant startDate,
      @Param("endDate") Instant endDate,
      @Param("categoryFilter") Long categoryFilter);

  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("DELETE FROM TimeEntry te WHERE te.id = :id")
  int deleteEntryById(@Param("id") Long id);
}
