package com.scholary.audionotes.api;

import com.scholary.audionotes.block.Block;
import com.scholary.audionotes.block.BlockType;
import com.scholary.audionotes.service.NoteDocumentService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for editing the blocks of an open note.
 *
 * <p>Every edit is applied as one batch on the live document, so blocks created here while a
 * recording runs are tagged with the current offset. Edits are not persisted until the note is
 * saved.
 */
@RestController
@RequestMapping("/notes/{noteId}/blocks")
@Tag(name = "Blocks", description = "Create, edit and remove blocks of a note")
public class BlockController {

  private final NoteDocumentService documents;

  public BlockController(NoteDocumentService documents) {
    this.documents = documents;
  }

  @GetMapping
  @Operation(summary = "Blocks of a note in document order, root first")
  public List<BlockResponse> list(@PathVariable String noteId) {
    return documents.blocks(noteId).stream().map(BlockResponse::from).toList();
  }

  @PostMapping
  @Operation(
      summary = "Add a block",
      description = "Opens an empty document for new notes. 400 if the kind cannot go there.")
  public ResponseEntity<BlockResponse> create(
      @PathVariable String noteId, @Valid @RequestBody BlockRequest request) {
    BlockType type = request.blockType();
    Block created =
        documents.createBlock(
            noteId,
            type,
            request.parentId(),
            request.position(),
            request.runs(),
            request.payload(type));
    return ResponseEntity.status(HttpStatus.CREATED).body(BlockResponse.from(created));
  }

  @PatchMapping("/{blockId}")
  @Operation(summary = "Replace a block's text and/or move it")
  public BlockResponse update(
      @PathVariable String noteId,
      @PathVariable String blockId,
      @RequestBody BlockUpdateRequest request) {
    return BlockResponse.from(
        documents.updateBlock(
            noteId, blockId, request.runs(), request.parentId(), request.index()));
  }

  @DeleteMapping("/{blockId}")
  @Operation(summary = "Remove a block and its descendants")
  public ResponseEntity<Void> delete(@PathVariable String noteId, @PathVariable String blockId) {
    documents.deleteBlock(noteId, blockId);
    return ResponseEntity.noContent().build();
  }
}
