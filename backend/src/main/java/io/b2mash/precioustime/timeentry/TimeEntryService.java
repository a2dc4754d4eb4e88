package io.b2mash.precioustime.timeentry;

import io.b2mash.precioustime.category.CategoryService;
import io.b2mash.precioustime.config.TrackerProperties;
import io.b2mash.precioustime.exception.ResourceNotFoundException;
import io.b2mash.precioustime.tag.TagService;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Owns the lifecycle of time entries. At most one entry is running at any time; starting a new
 * timer closes the running one inside the same transaction.
 */
@Service
public class TimeEntryService {

  private static final Logger log = LoggerFactory.getLogger(TimeEntryService.class);

  static final String DEFAULT_DESCRIPTION = "No description";

  private final TimeEntryRepository timeEntryRepository;
  private final TimerLockRepository timerLockRepository;
  private final TimeEntryRestoreRepository timeEntryRestoreRepository;
  private final TagService tagService;
  private final CategoryService categoryService;
  private final TransactionTemplate transactionTemplate;
  private final TrackerProperties properties;
  private final Clock clock;

  public TimeEntryService(
      TimeEntryRepository timeEntryRepository,
      TimerLockRepository timerLockRepository,
      TimeEntryRestoreRepository timeEntryRestoreRepository,
      TagService tagService,
      CategoryService categoryService,
      TransactionTemplate transactionTemplate,
      TrackerProperties properties,
      Clock clock) {
    this.timeEntryRepository = timeEntryRepository;
    this.timerLockRepository = timerLockRepository;
    this.timeEntryRestoreRepository = timeEntryRestoreRepository;
    this.tagService = tagService;
    this.categoryService = categoryService;
    this.transactionTemplate = transactionTemplate;
    this.properties = properties;
    this.clock = clock;
  }

  /**
   * Starts a new running entry, closing whatever was running first. The timer lock row is held
   * until commit, so a concurrent start waits and then sees this entry as the running one.
   */
  @Transactional
  public TimeEntryWithCategory start(String description, Long categoryId) {
    timerLockRepository
        .findByIdForUpdate(TimerLock.ID)
        .orElseThrow(() -> new IllegalStateException("Timer lock row is missing"));
    var text = description == null || description.isBlank() ? DEFAULT_DESCRIPTION : description;
    categoryService.requireExists(categoryId);

    var now = now();
    for (var running : timeEntryRepository.findRunning()) {
      running.close(now);
      log.info("Closed running time entry {} before starting a new one", running.getId());
    }

    var saved = timeEntryRepository.save(TimeEntry.running(text, now, categoryId, now));
    var tags = tagService.syncTags(saved.getId(), text);
    log.info("Started time entry {} (category={}, tags={})", saved.getId(), categoryId, tags);

    return requireWithCategory(saved.getId());
  }

  /** Closes the running entry. Returns empty, without failing, when nothing is running. */
  @Transactional
  public Optional<TimeEntryWithCategory> stop() {
    var running = timeEntryRepository.findRunning();
    if (running.isEmpty()) {
      log.debug("Stop requested with no running time entry");
      return Optional.empty();
    }
    var now = now();
    running.forEach(entry -> entry.close(now));
    timeEntryRepository.saveAll(running);

    var stopped = running.get(0);
    log.info("Stopped time entry {}", stopped.getId());
    return timeEntryRepository.findWithCategoryById(stopped.getId());
  }

  /**
   * Overwrites every mutable field of an entry and resyncs its tags. The interval is not checked;
   * callers validate end after start when they need to.
   */
  @Transactional
  public TimeEntryWithCategory updateTimeEntry(
      Long id, String description, Instant startTime, Instant endTime, Long categoryId) {
    var entry =
        timeEntryRepository
            .findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("TimeEntry", id));
    categoryService.requireExists(categoryId);

    entry.overwrite(description, startTime, endTime, categoryId);
    timeEntryRepository.save(entry);
    var tags = tagService.syncTags(id, description);
    log.info("Updated time entry {} (state={}, tags={})", id, entry.getState(), tags);

    return requireWithCategory(id);
  }

  /** Rewrites description and category of the running entry, keeping its start time. */
  @Transactional
  public TimeEntryWithCategory updateActiveEntry(String description, Long categoryId) {
    var active =
        timeEntryRepository.findRunning().stream()
            .findFirst()
            .orElseThrow(ResourceNotFoundException::noActiveEntry);
    categoryService.requireExists(categoryId);

    var text = description == null || description.isBlank() ? DEFAULT_DESCRIPTION : description;
    active.describe(text, categoryId);
    timeEntryRepository.save(active);
    tagService.syncTags(active.getId(), text);
    log.info("Updated running time entry {}", active.getId());

    return requireWithCategory(active.getId());
  }

  /**
   * Deletes an entry and its tag links. Orphaned tags are cleaned up afterwards on a best-effort
   * basis; a failure there is logged and does not undo the delete.
   */
  public void deleteTimeEntry(Long id) {
    Integer deleted =
        transactionTemplate.execute(
            tx -> {
              tagService.unlinkAll(id);
              return timeEntryRepository.deleteEntryById(id);
            });
    if (deleted == null || deleted == 0) {
      log.debug("Delete of time entry {} affected no rows", id);
    } else {
      log.info("Deleted time entry {}", id);
    }

    try {
      tagService.deleteOrphanedTags();
    } catch (DataAccessException ex) {
      log.warn("Orphaned tag cleanup after deleting time entry {} failed", id, ex);
    }
  }

  /**
   * Creates or overwrites an entry from imported data and resyncs its tags. A positive id is kept:
   * the entry under it is overwritten, or created under that id when absent. Without an id the new
   * entry gets a generated one. Joins the caller's transaction.
   *
   * <p>Call {@link #reserveImportedIds} with the highest imported id first.
   */
  @Transactional
  public ImportedEntry importEntry(
      Long id, String description, Instant startTime, Instant endTime, Long categoryId) {
    boolean explicitId = id != null && id > 0;
    Optional<TimeEntry> existing =
        explicitId ? timeEntryRepository.findById(id) : Optional.empty();

    Long entryId;
    boolean created;
    if (existing.isPresent()) {
      var entry = existing.get();
      entry.overwrite(description, startTime, endTime, categoryId);
      entryId = timeEntryRepository.save(entry).getId();
      created = false;
    } else if (explicitId) {
      timeEntryRestoreRepository.insertWithId(
          id, description, startTime, endTime, categoryId, now());
      entryId = id;
      created = true;
    } else {
      var entry = new TimeEntry(description, startTime, endTime, categoryId, now());
      entryId = timeEntryRepository.save(entry).getId();
      created = true;
    }
    tagService.syncTags(entryId, description);
    return new ImportedEntry(entryId, created);
  }

  /**
   * Makes generated ids continue after {@code maxId} when it exceeds every stored id. Runs outside
   * any transaction; a later rollback of the import only leaves a gap in the ids.
   */
  public void reserveImportedIds(long maxId) {
    timeEntryRestoreRepository.advanceIdentityPast(maxId);
  }

  @Transactional(readOnly = true)
  public TimeEntryWithCategory getTimeEntry(Long id) {
    return requireWithCategory(id);
  }

  @Transactional(readOnly = true)
  public Optional<TimeEntryWithCategory> getActiveTimeEntry() {
    return timeEntryRepository.findRunningWithCategory().stream().findFirst();
  }

  @Transactional(readOnly = true)
  public List<TimeEntryWithCategory> listRecentTimeEntries() {
    return timeEntryRepository.findRecentWithCategory(
        PageRequest.of(0, properties.recentEntriesLimit()));
  }

  @Transactional(readOnly = true)
  public List<TimeEntryWithCategory> listAllTimeEntries() {
    return timeEntryRepository.findAllWithCategory();
  }

  private TimeEntryWithCategory requireWithCategory(Long id) {
    return timeEntryRepository
        .findWithCategoryById(id)
        .orElseThrow(() -> new ResourceNotFoundException("TimeEntry", id));
  }

  private Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.SECONDS);
  }

  /** Outcome of {@link #importEntry}: the entry id and whether it was newly created. */
  public record ImportedEntry(Long id, boolean created) {}
}
