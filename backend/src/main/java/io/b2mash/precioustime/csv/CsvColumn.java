package io.b2mash.precioustime.csv;

import io.b2mash.precioustime.exception.ValidationFailureException;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/** Columns of the time entry CSV format, in export order. */
public enum CsvColumn {
  ID("id", false),
  DESCRIPTION("description", true),
  START_TIME("start_time", true),
  END_TIME("end_time", false),
  CATEGORY("category", false);

  private final String header;
  private final boolean required;

  CsvColumn(String header, boolean required) {
    this.header = header;
    this.required = required;
  }

  public String header() {
    return header;
  }

  public static List<String> headers() {
    return Arrays.stream(values()).map(CsvColumn::header).toList();
  }

  /**
   * Maps each known column to its position in {@code headerRow}. Names are compared
   * case-insensitively after trimming; unknown columns are ignored and the first occurrence of a
   * repeated name wins.
   *
   * @throws ValidationFailureException if a required column is absent
   */
  public static Map<CsvColumn, Integer> indexHeader(List<String> headerRow) {
    var index = new EnumMap<CsvColumn, Integer>(CsvColumn.class);
    for (int i = 0; i < headerRow.size(); i++) {
      var name = headerRow.get(i).trim().toLowerCase(Locale.ROOT);
      for (var column : values()) {
        if (column.header.equals(name)) {
          index.putIfAbsent(column, i);
        }
      }
    }

    var missing =
        Arrays.stream(values())
            .filter(column -> column.required && !index.containsKey(column))
            .map(CsvColumn::header)
            .collect(Collectors.joining(", "));
    if (!missing.isEmpty()) {
      throw new ValidationFailureException(
          "Invalid CSV header", "Missing required column(s): " + missing, missing);
    }
    return index;
  }
}
