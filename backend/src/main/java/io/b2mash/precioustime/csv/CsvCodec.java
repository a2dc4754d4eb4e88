package io.b2mash.precioustime.csv;

import io.b2mash.precioustime.exception.ValidationFailureException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * RFC 4180 reading and writing. Records are separated by CRLF, LF or a lone CR; fields containing a
 * comma, quote or line break are quoted with inner quotes doubled.
 */
public final class CsvCodec {

  private static final char BOM = '\uFEFF';

  private CsvCodec() {}

  /** Renders one record without the trailing line break. */
  public static String formatRow(List<String> values) {
    return values.stream().map(CsvCodec::escape).collect(Collectors.joining(","));
  }

  static String escape(String value) {
    if (value == null) {
      return "";
    }
    if (value.contains(",")
        || value.contains("\"")
        || value.contains("\n")
        || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }

  /**
   * Splits {@code content} into records of raw field values. Blank lines are dropped, a leading
   * byte order mark is ignored, and text after a closing quote is kept as part of the field.
   *
   * @throws ValidationFailureException if a quoted field is never closed
   */
  public static List<List<String>> parse(String content) {
    var records = new ArrayList<List<String>>();
    if (content == null || content.isEmpty()) {
      return records;
    }

    int start = content.charAt(0) == BOM ? 1 : 0;
    var fields = new ArrayList<String>();
    var field = new StringBuilder();
    boolean quoted = false;
    boolean fieldStarted = false;
    int line = 1;
    int quoteLine = 0;

    for (int i = start; i < content.length(); i++) {
      char c = content.charAt(i);
      if (quoted) {
        if (c == '"') {
          if (i + 1 < content.length() && content.charAt(i + 1) == '"') {
            field.append('"');
            i++;
          } else {
            quoted = false;
          }
        } else {
          if (c == '\n') {
            line++;
          }
          field.append(c);
        }
        continue;
      }

      switch (c) {
        case '"' -> {
          if (!fieldStarted) {
            quoted = true;
            quoteLine = line;
          } else {
            field.append(c);
          }
          fieldStarted = true;
        }
        case ',' -> {
          fields.add(field.toString());
          field.setLength(0);
          fieldStarted = false;
        }
        case '\r', '\n' -> {
          if (c == '\r' && i + 1 < content.length() && content.charAt(i + 1) == '\n') {
            i++;
          }
          line++;
          endRecord(records, fields, field, fieldStarted);
          fields = new ArrayList<>();
          field.setLength(0);
          fieldStarted = false;
        }
        default -> {
          field.append(c);
          fieldStarted = true;
        }
      }
    }

    if (quoted) {
      throw new ValidationFailureException(
          "Malformed CSV", "Unterminated quoted field starting on line " + quoteLine);
    }
    endRecord(records, fields, field, fieldStarted);
    return records;
  }

  private static void endRecord(
      List<List<String>> records,
      List<String> fields,
      StringBuilder field,
      boolean fieldStarted) {
    if (fields.isEmpty() && !fieldStarted && field.isEmpty()) {
      return;
    }
    fields.add(field.toString());
    records.add(List.copyOf(fields));
  }
}
