package io.b2mash.precioustime.timeentry;

import jakarta.persistence.LockModeType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TimerLockRepository extends JpaRepository<TimerLock, Long> {

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT l FROM TimerLock l WHERE l.id = :id")
  Optional<TimerLock> findByIdForUpdate(@Param("id") Long id);
}
