package io.b2mash.precioustime.category;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.b2mash.precioustime.tag.TagRepository;
import io.b2mash.precioustime.tag.TimeEntryTagRepository;
import io.b2mash.precioustime.timeentry.TimeEntryRepository;
import io.b2mash.precioustime.timeentry.TimeEntryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class CategoryIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private CategoryService categoryService;
  @Autowired private TimeEntryService timeEntryService;
  @Autowired private CategoryRepository categoryRepository;
  @Autowired private TimeEntryRepository timeEntryRepository;
  @Autowired private TagRepository tagRepository;
  @Autowired private TimeEntryTagRepository timeEntryTagRepository;

  @BeforeEach
  void clearStore() {
    timeEntryTagRepository.deleteAllInBatch();
    timeEntryRepository.deleteAllInBatch();
    tagRepository.deleteAllInBatch();
    categoryRepository.deleteAllInBatch();
  }

  @Test
  void create_defaultsColorAndListsByName() throws Exception {
    mockMvc
        .perform(
            post("/api/categories")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "  Work  "}
                    """))
        .andExpect(status().isCreated())
        .andExpect(header().exists("Location"))
        .andExpect(jsonPath("$.name").value("Work"))
        .andExpect(jsonPath("$.color").value("#cccccc"));
    categoryService.createCategory("Admin", "#123456");

    mockMvc
        .perform(get("/api/categories"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[*].name", contains("Admin", "Work")));
  }

  @Test
  void create_duplicateName_returns409() throws Exception {
    categoryService.createCategory("Work", null);

    mockMvc
        .perform(
            post("/api/categories")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Work", "color": "#ff0000"}
                    """))
        .andExpect(status().isConflict());
  }

  @Test
  void create_invalidColor_returns400() throws Exception {
    mockMvc
        .perform(
            post("/api/categories")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Work", "color": "red"}
                    """))
        .andExpect(status().isBadRequest());
  }

  @Test
  void update_renamesAndRecolors() throws Exception {
    var category = categoryService.createCategory("Wrok", null);

    mockMvc
        .perform(
            put("/api/categories/{id}", category.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Work", "color": "#00ff00"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.name").value("Work"))
        .andExpect(jsonPath("$.color").value("#00ff00"));
  }

  @Test
  void delete_keepsEntriesAndClearsTheirCategory() throws Exception {
    var category = categoryService.createCategory("Temporary", null);
    var entry = timeEntryService.start("categorized", category.getId());
    assertThat(entry.categoryName()).isEqualTo("Temporary");

    mockMvc
        .perform(delete("/api/categories/{id}", category.getId()))
        .andExpect(status().isNoContent());

    var after = timeEntryService.getTimeEntry(entry.id());
    assertThat(after.categoryId()).isNull();
    assertThat(after.categoryName()).isNull();
    assertThat(categoryRepository.count()).isZero();
  }

  @Test
  void delete_unknownId_returns404() throws Exception {
    mockMvc.perform(delete("/api/categories/{id}", 777_777)).andExpect(status().isNotFound());
  }

  @Test
  void getOrCreateByName_reusesExisting() {
    var first = categoryService.getOrCreateByName("Imported");
    var second = categoryService.getOrCreateByName("Imported");

    assertThat(second.getId()).isEqualTo(first.getId());
    assertThat(first.getColor()).isEqualTo("#cccccc");
  }
}
