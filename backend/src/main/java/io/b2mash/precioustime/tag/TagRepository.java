package io.b2mash.precioustime.tag;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TagRepository extends JpaRepository<Tag, Long> {

  @Query("SELECT t FROM Tag t ORDER BY t.name ASC")
  List<Tag> findByOrderByNameAsc();

  @Query("SELECT t FROM Tag t WHERE t.name = :name")
  Optional<Tag> findByName(@Param("name") String name);

  @Query(
      """
      SELECT t FROM Tag t
      WHERE t.id IN (SELECT l.tagId FROM TimeEntryTag l WHERE l.timeEntryId = :timeEntryId)
      ORDER BY t.name ASC
      """)
  List<Tag> findByTimeEntryId(@Param("timeEntryId") Long timeEntryId);

  /**
   * Deletes every tag that no entry links to. Clears the persistence context afterwards since
   * removed tags may still be managed.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      "DELETE FROM Tag t WHERE NOT EXISTS (SELECT 1 FROM TimeEntryTag l WHERE l.tagId = t.id)")
  int deleteOrphaned();
}
