package io.b2mash.b2b.contractassembly.content;

import io.b2mash.b2b.contractassembly.content.dto.ContentImportRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/content")
public class ContentImportController {

  private final ContentImportService importService;

  public ContentImportController(ContentImportService importService) {
    this.importService = importService;
  }

  @PostMapping("/import")
  public ResponseEntity<ImportReport> importContent(
      @Valid @RequestBody ContentImportRequest request) {
    return ResponseEntity.status(HttpStatus.CREATED).body(importService.importContent(request));
  }
}
