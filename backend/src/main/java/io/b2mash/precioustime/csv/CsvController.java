package io.b2mash.precioustime.csv;

import io.b2mash.precioustime.exception.ValidationFailureException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/csv")
public class CsvController {

  static final String EXPORT_FILE_NAME = "time-entries.csv";
  private static final MediaType TEXT_CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

  private final CsvTransferService csvTransferService;

  public CsvController(CsvTransferService csvTransferService) {
    this.csvTransferService = csvTransferService;
  }

  @GetMapping("/export")
  public ResponseEntity<byte[]> export() {
    var disposition = ContentDisposition.attachment().filename(EXPORT_FILE_NAME).build();
    return ResponseEntity.ok()
        .contentType(TEXT_CSV)
        .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
        .body(csvTransferService.exportCsv());
  }

  @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<ImportResult> importCsv(@RequestParam("file") MultipartFile file)
      throws IOException {
    return ResponseEntity.ok(csvTransferService.importCsv(readContent(file)));
  }

  @PostMapping(value = "/preview", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<List<CsvPreviewEntry>> preview(@RequestParam("file") MultipartFile file)
      throws IOException {
    return ResponseEntity.ok(csvTransferService.previewCsv(readContent(file)));
  }

  private static String readContent(MultipartFile file) throws IOException {
    if (file.isEmpty()) {
      throw new ValidationFailureException("Invalid file", "File is empty");
    }
    return new String(file.getBytes(), StandardCharsets.UTF_8);
  }
}
