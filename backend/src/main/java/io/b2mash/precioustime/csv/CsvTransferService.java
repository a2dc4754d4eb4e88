package io.b2mash.precioustime.csv;

import io.b2mash.precioustime.category.CategoryService;
import io.b2mash.precioustime.config.TrackerProperties;
import io.b2mash.precioustime.exception.ValidationFailureException;
import io.b2mash.precioustime.timeentry.TimeEntryRepository;
import io.b2mash.precioustime.timeentry.TimeEntryService;
import io.b2mash.precioustime.timeentry.TimeEntryWithCategory;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/** Moves time entries in and out of the CSV format. */
@Service
public class CsvTransferService {

  private static final Logger log = LoggerFactory.getLogger(CsvTransferService.class);

  private final TimeEntryService timeEntryService;
  private final TimeEntryRepository timeEntryRepository;
  private final CategoryService categoryService;
  private final TrackerProperties properties;
  private final TransactionTemplate transactionTemplate;
  private final FlexibleTimestampParser timestampParser;

  public CsvTransferService(
      TimeEntryService timeEntryService,
      TimeEntryRepository timeEntryRepository,
      CategoryService categoryService,
      TransactionTemplate transactionTemplate,
      TrackerProperties properties) {
    this.timeEntryService = timeEntryService;
    this.timeEntryRepository = timeEntryRepository;
    this.categoryService = categoryService;
    this.transactionTemplate = transactionTemplate;
    this.properties = properties;
    this.timestampParser = new FlexibleTimestampParser(properties.csv().naiveZoneId());
  }

  /**
   * Every entry, running ones included, ordered by start time. Timestamps carry the offset of the
   * configured zone.
   */
  @Transactional(readOnly = true)
  public byte[] exportCsv() {
    var entries = timeEntryService.listAllTimeEntries();
    var sb = new StringBuilder(CsvCodec.formatRow(CsvColumn.headers())).append('\n');
    for (var entry : entries) {
      sb.append(
              CsvCodec.formatRow(
                  List.of(
                      String.valueOf(entry.id()),
                      entry.description(),
                      formatInstant(entry.startTime()),
                      formatInstant(entry.endTime()),
                      Objects.requireNonNullElse(entry.categoryName(), ""))))
          .append('\n');
    }
    log.info("Exported {} time entries to CSV", entries.size());
    return sb.toString().getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Applies every row of {@code content} in one transaction. All rows are parsed before anything
   * is written, so a bad timestamp leaves the store untouched. Rows keep their ids: id generation
   * is first moved past the highest imported id, outside the write transaction.
   *
   * @throws ValidationFailureException on a missing required column or an unparseable timestamp
   */
  public ImportResult importCsv(String content) {
    var rows = readRows(content);

    var parsed = new ArrayList<ParsedRow>();
    for (var row : rows) {
      var start =
          timestampParser
              .parse(row.startTime())
              .orElseThrow(() -> invalidTimestamp(row, CsvColumn.START_TIME, row.startTime()));
      Instant end = null;
      if (!row.endTime().isEmpty()) {
        end =
            timestampParser
                .parse(row.endTime())
                .orElseThrow(() -> invalidTimestamp(row, CsvColumn.END_TIME, row.endTime()));
      }
      parsed.add(new ParsedRow(row, start, end));
    }

    parsed.stream()
        .map(item -> item.row().id())
        .filter(Objects::nonNull)
        .max(Long::compare)
        .ifPresent(timeEntryService::reserveImportedIds);

    var result = transactionTemplate.execute(tx -> applyRows(parsed));
    log.info("Imported CSV: {} created, {} updated", result.created(), result.updated());
    return result;
  }

  private ImportResult applyRows(List<ParsedRow> parsed) {
    int created = 0;
    int updated = 0;
    for (var item : parsed) {
      var row = item.row();
      Long categoryId = null;
      if (!row.category().isEmpty()) {
        categoryId = categoryService.getOrCreateByName(row.category()).getId();
      }
      var result =
          timeEntryService.importEntry(
              row.id(), row.description(), item.start(), item.end(), categoryId);
      if (result.created()) {
        created++;
      } else {
        updated++;
      }
    }
    return new ImportResult(created, updated);
  }

  /**
   * Dry run of {@link #importCsv}. Rows identical to their stored entry are left out; rows with an
   * unparseable start are skipped and an unparseable end counts as absent.
   */
  @Transactional(readOnly = true)
  public List<CsvPreviewEntry> previewCsv(String content) {
    var preview = new ArrayList<CsvPreviewEntry>();
    for (var row : readRows(content)) {
      var start = timestampParser.parse(row.startTime());
      if (start.isEmpty()) {
        log.debug("Preview skips row {}: unparseable start '{}'", row.number(), row.startTime());
        continue;
      }
      var end = timestampParser.parse(row.endTime()).orElse(null);

      Optional<TimeEntryWithCategory> existing =
          row.id() == null ? Optional.empty() : timeEntryRepository.findWithCategoryById(row.id());
      if (existing.isEmpty()) {
        preview.add(
            new CsvPreviewEntry(
                row.number(),
                row.id(),
                row.description(),
                start.get(),
                end,
                row.category(),
                PreviewStatus.NEW,
                false,
                false,
                false,
                false));
        continue;
      }

      var current = existing.get();
      boolean descriptionChanged = !current.description().equals(row.description());
      boolean startChanged = !current.startTime().equals(start.get());
      boolean endChanged = !Objects.equals(current.endTime(), end);
      boolean categoryChanged =
          !Objects.requireNonNullElse(current.categoryName(), "").equals(row.category());
      if (!descriptionChanged && !startChanged && !endChanged && !categoryChanged) {
        continue;
      }
      preview.add(
          new CsvPreviewEntry(
              row.number(),
              row.id(),
              row.description(),
              start.get(),
              end,
              row.category(),
              PreviewStatus.UPDATED,
              descriptionChanged,
              startChanged,
              endChanged,
              categoryChanged));
    }
    return preview;
  }

  /** Data rows with trimmed values. Rows lacking a description or start time are dropped. */
  private List<CsvRow> readRows(String content) {
    var records = CsvCodec.parse(content);
    if (records.isEmpty()) {
      return List.of();
    }
    var header = CsvColumn.indexHeader(records.get(0));

    var rows = new ArrayList<CsvRow>();
    for (int i = 1; i < records.size(); i++) {
      var record = records.get(i);
      var row =
          new CsvRow(
              i + 1,
              parseId(value(record, header, CsvColumn.ID)),
              value(record, header, CsvColumn.DESCRIPTION),
              value(record, header, CsvColumn.START_TIME),
              value(record, header, CsvColumn.END_TIME),
              value(record, header, CsvColumn.CATEGORY));
      if (row.description().isEmpty() || row.startTime().isEmpty()) {
        log.debug("Skipping CSV row {} without description or start time", row.number());
        continue;
      }
      rows.add(row);
    }
    return rows;
  }

  private static String value(
      List<String> record, Map<CsvColumn, Integer> header, CsvColumn column) {
    var index = header.get(column);
    if (index == null || index >= record.size()) {
      return "";
    }
    return record.get(index).trim();
  }

  /** Positive ids only; anything else means "no id". */
  private static Long parseId(String value) {
    if (value.isEmpty()) {
      return null;
    }
    try {
      long id = Long.parseLong(value);
      return id > 0 ? id : null;
    } catch (NumberFormatException e) {
      log.debug("Ignoring non-numeric CSV id '{}'", value);
      return null;
    }
  }

  private String formatInstant(Instant instant) {
    if (instant == null) {
      return "";
    }
    return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(instant.atZone(properties.zoneId()));
  }

  private static ValidationFailureException invalidTimestamp(
      CsvRow row, CsvColumn column, String value) {
    return new ValidationFailureException(
        "Invalid CSV timestamp",
        "Row %d: invalid %s '%s'".formatted(row.number(), column.header(), value),
        value);
  }

  private record CsvRow(
      int number, Long id, String description, String startTime, String endTime, String category) {}

  private record ParsedRow(CsvRow row, Instant start, Instant end) {}
}
