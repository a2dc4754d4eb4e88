package io.b2mash.precioustime.tag;

import io.b2mash.precioustime.tag.dto.TagResponse;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TagService {

  private static final Logger log = LoggerFactory.getLogger(TagService.class);

  private final TagRepository tagRepository;
  private final TimeEntryTagRepository timeEntryTagRepository;

  public TagService(TagRepository tagRepository, TimeEntryTagRepository timeEntryTagRepository) {
    this.tagRepository = tagRepository;
    this.timeEntryTagRepository = timeEntryTagRepository;
  }

  @Transactional(readOnly = true)
  public List<TagResponse> listAll() {
    return tagRepository.findByOrderByNameAsc().stream().map(TagResponse::from).toList();
  }

  @Transactional(readOnly = true)
  public List<TagResponse> listForEntry(Long timeEntryId) {
    return tagRepository.findByTimeEntryId(timeEntryId).stream().map(TagResponse::from).toList();
  }

  /**
   * Replaces the links of an entry with the tags found in {@code description}, creating missing
   * tags, then removes tags left without links. Joins the caller's transaction.
   */
  @Transactional
  public List<String> syncTags(Long timeEntryId, String description) {
    timeEntryTagRepository.deleteByTimeEntryId(timeEntryId);

    var names = TagExtractor.extract(description);
    for (String name : names) {
      var tag = tagRepository.findByName(name).orElseGet(() -> tagRepository.save(new Tag(name)));
      timeEntryTagRepository.save(new TimeEntryTag(timeEntryId, tag.getId()));
    }

    int removed = tagRepository.deleteOrphaned();
    log.debug(
        "Synced tags for time entry {}: tags={}, orphansRemoved={}", timeEntryId, names, removed);
    return names;
  }

  @Transactional
  public void unlinkAll(Long timeEntryId) {
    timeEntryTagRepository.deleteByTimeEntryId(timeEntryId);
  }

  @Transactional
  public int deleteOrphanedTags() {
    int removed = tagRepository.deleteOrphaned();
    if (removed > 0) {
      log.info("Deleted {} orphaned tag(s)", removed);
    }
    return removed;
  }

  /**
   * Batch-loads tag ids for several entries in one query. Every requested entry id is present in
   * the result, mapped to an empty set when it has no links.
   */
  @Transactional(readOnly = true)
  public Map<Long, Set<Long>> tagIdsByEntry(Collection<Long> timeEntryIds) {
    if (timeEntryIds == null || timeEntryIds.isEmpty()) {
      return Map.of();
    }
    Map<Long, Set<Long>> result =
        timeEntryTagRepository.findByTimeEntryIdIn(timeEntryIds).stream()
            .collect(
                Collectors.groupingBy(
                    TimeEntryTag::getTimeEntryId,
                    Collectors.mapping(TimeEntryTag::getTagId, Collectors.toSet())));
    for (Long id : timeEntryIds) {
      result.putIfAbsent(id, Set.of());
    }
    return result;
  }
}
