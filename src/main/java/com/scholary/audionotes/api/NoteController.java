package com.scholary.audionotes.api;

import com.scholary.audionotes.service.NoteDocumentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for note documents.
 *
 * <p>Snapshots are the lossless persisted form. Markdown is for exchange: audio blocks, block
 * references and backlinks are exported as plain stand-ins and do not come back on import.
 */
@RestController
@RequestMapping("/notes/{noteId}")
@Tag(name = "Notes", description = "Import and export note documents")
public class NoteController {

  static final String TEXT_MARKDOWN = "text/markdown";

  private final NoteDocumentService documents;

  public NoteController(NoteDocumentService documents) {
    this.documents = documents;
  }

  @GetMapping("/markup")
  @Operation(summary = "Export a note as Markdown")
  public ResponseEntity<String> exportMarkup(@PathVariable String noteId) {
    return ResponseEntity.ok()
        .contentType(MediaType.valueOf(TEXT_MARKDOWN))
        .body(documents.exportMarkup(noteId));
  }

  @PutMapping(
      value = "/markup",
      consumes = {TEXT_MARKDOWN, MediaType.TEXT_PLAIN_VALUE})
  @Operation(
      summary = "Replace a note with imported Markdown",
      description = "The imported document gets fresh block ids and is saved immediately.")
  public ResponseEntity<Void> importMarkup(
      @PathVariable String noteId, @RequestBody(required = false) String markup) {
    documents.importMarkup(noteId, markup == null ? "" : markup);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/snapshot")
  @Operation(summary = "Export a note's lossless snapshot")
  public ResponseEntity<byte[]> exportSnapshot(@PathVariable String noteId) {
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .body(documents.exportSnapshot(noteId));
  }

  @PutMapping(value = "/snapshot", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Replace a note with a snapshot",
      description = "Rejected with 422 if the snapshot is malformed or structurally invalid.")
  public ResponseEntity<Void> importSnapshot(
      @PathVariable String noteId, @RequestBody byte[] snapshot) {
    documents.importSnapshot(noteId, snapshot);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/save")
  @Operation(summary = "Persist the open document of a note")
  public ResponseEntity<Void> save(@PathVariable String noteId) {
    documents.save(noteId);
    return ResponseEntity.noContent().build();
  }
}
