package com.scholary.audionotes.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.audionotes.block.Block;
import com.scholary.audionotes.block.BlockPayload;
import com.scholary.audionotes.block.BlockTree;
import com.scholary.audionotes.block.BlockType;
import com.scholary.audionotes.block.StructuralException;
import com.scholary.audionotes.block.TextRun;
import com.scholary.audionotes.codec.DecodeException;
import com.scholary.audionotes.codec.MarkupCodec;
import com.scholary.audionotes.codec.SnapshotCodec;
import com.scholary.audionotes.recording.CaptureService;
import com.scholary.audionotes.recording.MutableClock;
import com.scholary.audionotes.recording.RecordingSession;
import com.scholary.audionotes.reference.AudioReference;
import com.scholary.audionotes.reference.InMemoryAudioReferenceStore;
import com.scholary.audionotes.reference.SnapshotStore;
import com.scholary.audionotes.tagging.AutoTagger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class NoteDocumentServiceTest {

  @Mock private AutoTagger autoTagger;

  private final Runnable detach = mock(Runnable.class);
  private final MapSnapshotStore snapshotStore = new MapSnapshotStore();
  private final SnapshotCodec snapshotCodec = new SnapshotCodec(new ObjectMapper());

  private NoteDocumentService service;

  @BeforeEach
  void setUp() {
    lenient().when(autoTagger.attach(any(BlockTree.class))).thenReturn(detach);
    service =
        new NoteDocumentService(snapshotStore, snapshotCodec, new MarkupCodec('-'), autoTagger);
  }

  @Test
  void open_shouldStartEmptyDocumentForNewNote() {
    NoteDocument document = service.open("note-1");

    assertThat(document.tree().size()).isEqualTo(1);
    assertThat(service.isOpen("note-1")).isTrue();
    verify(autoTagger).attach(document.tree());
  }

  @Test
  void open_shouldReturnSameDocumentWhileOpen() {
    NoteDocument first = service.open("note-1");

    assertThat(service.open("note-1")).isSameAs(first);
    assertThat(service.get("note-1")).isSameAs(first);
  }

  @Test
  void get_shouldThrowForUnknownNote() {
    assertThatThrownBy(() -> service.get("ghost"))
        .isInstanceOf(NoteNotFoundException.class)
        .hasMessageContaining("ghost");
  }

  @Test
  void save_shouldPersistSnapshotThatReopensIdentically() {
    BlockTree tree = service.open("note-1").tree();
    tree.createBlock(
        BlockType.HEADING,
        tree.rootId(),
        -1,
        List.of(TextRun.plain("Week 1")),
        new BlockPayload.Heading(1));

    service.save("note-1");
    service.close("note-1");
    BlockTree reopened = service.open("note-1").tree();

    assertThat(reopened.contentEquals(tree)).isTrue();
  }

  @Test
  void close_shouldDetachTagger() {
    service.open("note-1");

    service.close("note-1");

    verify(detach).run();
    assertThat(service.isOpen("note-1")).isFalse();
  }

  @Test
  void importMarkup_shouldReplaceAndSaveDocument() {
    service.open("note-1");

    service.importMarkup("note-1", "# Imported\n\nBody text\n");

    verify(detach).run();
    assertThat(snapshotStore.snapshots).containsKey("note-1");
    assertThat(service.exportMarkup("note-1")).isEqualTo("# Imported\n\nBody text\n");
  }

  @Test
  void importSnapshot_shouldKeepOpenDocumentWhenSnapshotIsInvalid() {
    NoteDocument original = service.open("note-1");

    assertThatThrownBy(
            () -> service.importSnapshot("note-1", "not json".getBytes(StandardCharsets.UTF_8)))
        .isInstanceOf(DecodeException.class);

    assertThat(service.get("note-1")).isSameAs(original);
    assertThat(snapshotStore.snapshots).isEmpty();
  }

  @Test
  void exportSnapshot_shouldRoundTripThroughImport() {
    BlockTree tree = service.open("note-1").tree();
    tree.createBlock(
        BlockType.PARAGRAPH, tree.rootId(), -1, List.of(TextRun.plain("kept")), null);

    byte[] snapshot = service.exportSnapshot("note-1");
    NoteDocument imported = service.importSnapshot("note-2", snapshot);

    assertThat(imported.tree().contentEquals(tree)).isTrue();
  }

  @Test
  void createBlock_shouldAppendUnderRootOfNewNote() {
    Block heading =
        service.createBlock(
            "note-1",
            BlockType.HEADING,
            null,
            -1,
            List.of(TextRun.plain("Agenda")),
            new BlockPayload.Heading(2));

    BlockTree tree = service.get("note-1").tree();
    assertThat(tree.getChildren(tree.rootId())).containsExactly(heading);
    assertThat(service.blocks("note-1")).hasSize(2);
  }

  @Test
  void createBlock_shouldRejectInvalidPlacementWithoutChangingDocument() {
    Block code =
        service.createBlock(
            "note-1", BlockType.CODE, null, -1, List.of(), new BlockPayload.Code(null));

    assertThatThrownBy(
            () -> service.createBlock("note-1", BlockType.PARAGRAPH, code.id(), -1, null, null))
        .isInstanceOf(StructuralException.class);
    assertThat(service.blocks("note-1")).hasSize(2);
  }

  @Test
  void updateBlock_shouldReplaceTextAndMoveInOneEdit() {
    Block first = service.createBlock("note-1", BlockType.PARAGRAPH, null, -1, null, null);
    Block second = service.createBlock("note-1", BlockType.PARAGRAPH, null, -1, null, null);

    Block updated =
        service.updateBlock("note-1", second.id(), List.of(TextRun.plain("moved")), null, 0);

    BlockTree tree = service.get("note-1").tree();
    assertThat(updated.plainText()).isEqualTo("moved");
    assertThat(tree.getChildren(tree.rootId()))
        .extracting(Block::id)
        .containsExactly(second.id(), first.id());
  }

  @Test
  void updateBlock_shouldRejectUnknownBlock() {
    service.open("note-1");

    assertThatThrownBy(() -> service.updateBlock("note-1", "ghost", List.of(), null, null))
        .isInstanceOf(StructuralException.class)
        .hasMessageContaining("ghost");
  }

  @Test
  void deleteBlock_shouldRemoveSubtree() {
    Block item =
        service.createBlock(
            "note-1", BlockType.LIST_ITEM, null, -1, null, BlockPayload.ListItem.bullet());
    service.createBlock(
        "note-1", BlockType.LIST_ITEM, item.id(), -1, null, BlockPayload.ListItem.bullet());

    service.deleteBlock("note-1", item.id());

    assertThat(service.blocks("note-1")).hasSize(1);
  }

  @Test
  void createBlock_shouldBeTaggedWhileRecording() {
    InMemoryAudioReferenceStore references = new InMemoryAudioReferenceStore();
    CaptureService captureService = mock(CaptureService.class);
    when(captureService.beginCapture(eq("note-1"), anyString())).thenReturn("/audio/a.wav");
    MutableClock clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
    RecordingSession session = new RecordingSession(captureService, references, clock);
    NoteDocumentService editing =
        new NoteDocumentService(
            snapshotStore,
            snapshotCodec,
            new MarkupCodec('-'),
            new AutoTagger(session, references, Runnable::run));

    editing.open("note-1");
    String recordingId = session.start("note-1").id();
    clock.advance(Duration.ofMillis(1500));
    Block typed =
        editing.createBlock(
            "note-1", BlockType.PARAGRAPH, null, -1, List.of(TextRun.plain("idea")), null);
    editing.updateBlock("note-1", typed.id(), List.of(TextRun.plain("idea, revised")), null, null);

    assertThat(references.findReferences(recordingId))
        .containsExactly(AudioReference.at(recordingId, typed.id(), 1500));
  }

  @Test
  void open_shouldFailOnCorruptStoredSnapshot() {
    snapshotStore.saveSnapshot("note-1", "{}".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> service.open("note-1")).isInstanceOf(DecodeException.class);
    assertThat(service.isOpen("note-1")).isFalse();
  }

  private static final class MapSnapshotStore implements SnapshotStore {

    private final Map<String, byte[]> snapshots = new HashMap<>();

    @Override
    public Optional<byte[]> loadSnapshot(String noteId) {
      return Optional.ofNullable(snapshots.get(noteId));
    }

    @Override
    public void saveSnapshot(String noteId, byte[] snapshot) {
      snapshots.put(noteId, snapshot);
    }
  }
}
