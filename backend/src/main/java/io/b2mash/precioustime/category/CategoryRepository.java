package io.b2mash.precioustime.category;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CategoryRepository extends JpaRepository<Category, Long> {

  @Query("SELECT c FROM Category c ORDER BY c.name ASC")
  List<Category> findByOrderByNameAsc();

  @Query("SELECT c FROM Category c WHERE c.name = :name")
  Optional<Category> findByName(@Param("name") String name);

  /** Nullifies the category reference on every entry that points at {@code categoryId}. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE TimeEntry te SET te.categoryId = NULL WHERE te.categoryId = :categoryId")
  int detachTimeEntries(@Param("categoryId") Long categoryId);
}
