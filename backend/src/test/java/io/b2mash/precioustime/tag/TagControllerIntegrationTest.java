package io.b2mash.precioustime.tag;

import static org.hamcrest.Matchers.contains;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.precioustime.category.CategoryRepository;
import io.b2mash.precioustime.timeentry.TimeEntryRepository;
import io.b2mash.precioustime.timeentry.TimeEntryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class TagControllerIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private TimeEntryService timeEntryService;
  @Autowired private TimeEntryRepository timeEntryRepository;
  @Autowired private TagRepository tagRepository;
  @Autowired private TimeEntryTagRepository timeEntryTagRepository;
  @Autowired private CategoryRepository categoryRepository;

  @BeforeEach
  void clearStore() {
    timeEntryTagRepository.deleteAllInBatch();
    timeEntryRepository.deleteAllInBatch();
    tagRepository.deleteAllInBatch();
    categoryRepository.deleteAllInBatch();
  }

  @Test
  void listTags_sortedByName() throws Exception {
    timeEntryService.start("#zeta and #Alpha", null);
    timeEntryService.start("#mid #alpha", null);

    mockMvc
        .perform(get("/api/tags"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].name", contains("alpha", "mid", "zeta")));
  }
}
