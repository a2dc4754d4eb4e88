package io.b2mash.precioustime.tag;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class TagServiceTest {

  @Mock private TagRepository tagRepository;
  @Mock private TimeEntryTagRepository timeEntryTagRepository;

  private TagService service;

  @BeforeEach
  void setUp() {
    service = new TagService(tagRepository, timeEntryTagRepository);
  }

  @Test
  void syncTags_reusesExistingCreatesMissingThenDropsOrphans() {
    var existing = tag(1L, "api");
    when(tagRepository.findByName("api")).thenReturn(Optional.of(existing));
    when(tagRepository.findByName("bug")).thenReturn(Optional.empty());
    when(tagRepository.save(any(Tag.class))).thenAnswer(inv -> withId(inv.getArgument(0), 2L));

    var names = service.syncTags(10L, "#API fix for #bug");

    assertThat(names).containsExactly("api", "bug");
    var links = ArgumentCaptor.forClass(TimeEntryTag.class);
    var order = inOrder(timeEntryTagRepository, tagRepository);
    order.verify(timeEntryTagRepository).deleteByTimeEntryId(10L);
    order.verify(timeEntryTagRepository, times(2)).save(links.capture());
    order.verify(tagRepository).deleteOrphaned();
    assertThat(links.getAllValues()).extracting(TimeEntryTag::getTagId).containsExactly(1L, 2L);
  }

  @Test
  void syncTags_noTags_onlyClearsLinks() {
    var names = service.syncTags(10L, "nothing to see");

    assertThat(names).isEmpty();
    verify(timeEntryTagRepository).deleteByTimeEntryId(10L);
    verify(timeEntryTagRepository, never()).save(any());
    verify(tagRepository).deleteOrphaned();
  }

  @Test
  void tagIdsByEntry_fillsEntriesWithoutLinks() {
    when(timeEntryTagRepository.findByTimeEntryIdIn(List.of(1L, 2L)))
        .thenReturn(List.of(new TimeEntryTag(1L, 5L), new TimeEntryTag(1L, 6L)));

    var result = service.tagIdsByEntry(List.of(1L, 2L));

    assertThat(result).containsEntry(1L, Set.of(5L, 6L)).containsEntry(2L, Set.of());
  }

  private static Tag tag(Long id, String name) {
    return withId(new Tag(name), id);
  }

  private static Tag withId(Tag tag, Long id) {
    ReflectionTestUtils.setField(tag, "id", id);
    return tag;
  }
}
