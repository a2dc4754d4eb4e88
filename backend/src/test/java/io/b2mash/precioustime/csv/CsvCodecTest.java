package io.b2mash.precioustime.csv;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.precioustime.exception.ValidationFailureException;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class CsvCodecTest {

  @Test
  void formatRow_quotesOnlyWhenNeeded() {
    var row = CsvCodec.formatRow(Arrays.asList("1", "a, b", "say \"hi\"", "two\nlines", null));

    assertThat(row).isEqualTo("1,\"a, b\",\"say \"\"hi\"\"\",\"two\nlines\",");
  }

  @Test
  void parse_quotedFieldsWithCommasQuotesAndNewlines() {
    var content = "id,description\r\n1,\"a, b\"\r\n2,\"say \"\"hi\"\"\"\n3,\"two\nlines\"\n";

    var records = CsvCodec.parse(content);

    assertThat(records)
        .containsExactly(
            List.of("id", "description"),
            List.of("1", "a, b"),
            List.of("2", "say \"hi\""),
            List.of("3", "two\nlines"));
  }

  @Test
  void parse_emptyFieldsAndMissingTrailingNewline() {
    var records = CsvCodec.parse("a,,c\n,,");

    assertThat(records).containsExactly(List.of("a", "", "c"), List.of("", "", ""));
  }

  @Test
  void parse_skipsBlankLinesAndByteOrderMark() {
    var records = CsvCodec.parse("\uFEFFid,description\n\n1,x\n\n");

    assertThat(records).containsExactly(List.of("id", "description"), List.of("1", "x"));
  }

  @Test
  void parse_formattedRowReadsBack() {
    var values = List.of("7", "coffee, \"black\"\n#break", "");

    var records = CsvCodec.parse(CsvCodec.formatRow(values) + "\n");

    assertThat(records).containsExactly(values);
  }

  @Test
  void parse_unterminatedQuote_fails() {
    assertThatThrownBy(() -> CsvCodec.parse("id,description\n1,\"open"))
        .isInstanceOf(ValidationFailureException.class)
        .hasMessageContaining("line 2");
  }

  @Test
  void parse_emptyContent_returnsNoRecords() {
    assertThat(CsvCodec.parse("")).isEmpty();
    assertThat(CsvCodec.parse(null)).isEmpty();
  }
}
