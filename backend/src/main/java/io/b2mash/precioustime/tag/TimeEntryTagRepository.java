package io.b2mash.precioustime.tag;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TimeEntryTagRepository extends JpaRepository<TimeEntryTag, Long> {

  @Query("SELECT l FROM TimeEntryTag l WHERE l.timeEntryId IN :timeEntryIds")
  List<TimeEntryTag> findByTimeEntryIdIn(@Param("timeEntryIds") Collection<Long> timeEntryIds);

  @Modifying(flushAutomatically = true)
  @Query("DELETE FROM TimeEntryTag l WHERE l.timeEntryId = :timeEntryId")
  int deleteByTimeEntryId(@Param("timeEntryId") Long timeEntryId);
}
