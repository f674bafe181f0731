package com.scholary.audionotes.api;

import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.audionotes.codec.DecodeException;
import com.scholary.audionotes.objectstore.ObjectStoreException;
import com.scholary.audionotes.service.NoteDocumentService;
import com.scholary.audionotes.service.NoteNotFoundException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(NoteController.class)
class NoteControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private NoteDocumentService documents;

  @Test
  void exportMarkup_shouldReturnMarkdown() throws Exception {
    when(documents.exportMarkup("note-1")).thenReturn("# Week 1\n");

    mockMvc
        .perform(get("/notes/note-1/markup"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith("text/markdown"))
        .andExpect(content().string("# Week 1\n"));
  }

  @Test
  void exportMarkup_shouldReturnNotFoundForUnknownNote() throws Exception {
    when(documents.exportMarkup("ghost")).thenThrow(new NoteNotFoundException("Note not found"));

    mockMvc
        .perform(get("/notes/ghost/markup"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value(ApiError.NOTE_NOT_FOUND))
        .andExpect(jsonPath("$.errorId").isNotEmpty());
  }

  @Test
  void importMarkup_shouldReplaceNote() throws Exception {
    mockMvc
        .perform(
            put("/notes/note-1/markup")
                .contentType(NoteController.TEXT_MARKDOWN)
                .content("# Imported\n"))
        .andExpect(status().isNoContent());

    verify(documents).importMarkup("note-1", "# Imported\n");
  }

  @Test
  void exportSnapshot_shouldReturnJsonBytes() throws Exception {
    byte[] snapshot = "{\"formatVersion\":1}".getBytes(StandardCharsets.UTF_8);
    when(documents.exportSnapshot("note-1")).thenReturn(snapshot);

    mockMvc
        .perform(get("/notes/note-1/snapshot"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(content().bytes(snapshot));
  }

  @Test
  void importSnapshot_shouldRejectInvalidSnapshot() throws Exception {
    byte[] snapshot = "{}".getBytes(StandardCharsets.UTF_8);
    when(documents.importSnapshot("note-1", snapshot))
        .thenThrow(new DecodeException("Snapshot is missing required field 'formatVersion'"));

    mockMvc
        .perform(
            put("/notes/note-1/snapshot").contentType(MediaType.APPLICATION_JSON).content(snapshot))
        .andExpect(status().isUnprocessableEntity())
        .andExpect(jsonPath("$.code").value(ApiError.SNAPSHOT_INVALID));
  }

  @Test
  void save_shouldReturnBadGatewayWhenStorageFails() throws Exception {
    doThrow(new ObjectStoreException("connection refused")).when(documents).save("note-1");

    mockMvc
        .perform(post("/notes/note-1/save"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value(ApiError.STORAGE_FAILED))
        .andExpect(jsonPath("$.message").value("Storage unavailable"));
  }

  @Test
  void save_shouldReturnNoContent() throws Exception {
    mockMvc.perform(post("/notes/note-1/save")).andExpect(status().isNoContent());

    verify(documents).save("note-1");
  }
}
