package com.scholary.audionotes.block;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered tree of blocks owned by one open document.
 *
 * <p>All changes run as batches: {@link #mutate} applies a sequence of operations to a working
 * copy of the tree and only swaps it in when every operation succeeded, so a failed batch never
 * leaves a partially edited document behind. After a successful batch the tree hands one ordered,
 * coalesced list of {@link MutationEvent}s to every registered listener.
 *
 * <p>The tree is single-writer: it must be driven from the editing thread, and {@code mutate}
 * rejects a nested call made while a batch is running.
 */
public class BlockTree {

  private static final Logger LOGGER = LoggerFactory.getLogger(BlockTree.class);

  private final Supplier<String> idGenerator;
  private final String rootId;
  private final List<MutationListener> listeners = new CopyOnWriteArrayList<>();

  private State state;
  private boolean batchRunning;

  public BlockTree() {
    this(() -> UUID.randomUUID().toString());
  }

  public BlockTree(Supplier<String> idGenerator) {
    this.idGenerator = idGenerator;
    this.rootId = idGenerator.get();
    this.state = new State();
    state.blocks.put(rootId, new Block(rootId, BlockType.ROOT, null, null, null));
  }

  private BlockTree(Supplier<String> idGenerator, String rootId, State state) {
    this.idGenerator = idGenerator;
    this.rootId = rootId;
    this.state = state;
  }

  /**
   * Rebuild a tree from a flat set of blocks, checking every structural invariant.
   *
   * @param rootId id of the root block
   * @param blocks all blocks of the document, root included
   * @param idGenerator generator for blocks created later on
   * @return the restored tree
   * @throws CycleException if parent links form a cycle
   * @throws StructuralException for any other broken invariant
   */
  public static BlockTree restore(
      String rootId, Collection<Block> blocks, Supplier<String> idGenerator) {
    State restored = new State();
    for (Block block : blocks) {
      if (restored.blocks.put(block.id(), block) != null) {
        throw new StructuralException("Duplicate block id: " + block.id());
      }
    }

    Block root = restored.blocks.get(rootId);
    if (root == null || root.type() != BlockType.ROOT) {
      throw new StructuralException("Root block missing: " + rootId);
    }

    for (Block block : restored.blocks.values()) {
      if (block.type() == BlockType.ROOT && !block.id().equals(rootId)) {
        throw new StructuralException("Second root block: " + block.id());
      }
      for (String childId : block.children()) {
        Block child = restored.blocks.get(childId);
        if (child == null) {
          throw new StructuralException(
              "Block " + block.id() + " references missing child " + childId);
        }
        if (!block.type().canContain(child.type())) {
          throw new StructuralException(
              block.type().wireName() + " cannot contain " + child.type().wireName());
        }
        String previous = restored.parents.put(childId, block.id());
        if (previous != null) {
          throw new StructuralException(
              "Block " + childId + " has two parents: " + previous + ", " + block.id());
        }
      }
    }

    Set<String> reachable = new HashSet<>();
    Deque<String> pending = new ArrayDeque<>();
    pending.push(rootId);
    while (!pending.isEmpty()) {
      String id = pending.pop();
      reachable.add(id);
      restored.blocks.get(id).children().forEach(pending::push);
    }

    for (String id : restored.blocks.keySet()) {
      if (!reachable.contains(id)) {
        if (hasParentCycle(id, restored.parents)) {
          throw new CycleException("Block " + id + " is part of a parent cycle");
        }
        throw new StructuralException("Block " + id + " is not reachable from the root");
      }
    }

    return new BlockTree(idGenerator, rootId, restored);
  }

  private static boolean hasParentCycle(String start, Map<String, String> parents) {
    Set<String> seen = new HashSet<>();
    String current = start;
    while (current != null) {
      if (!seen.add(current)) {
        return true;
      }
      current = parents.get(current);
    }
    return false;
  }

  /** Independent copy with the same ids and content but no listeners. */
  public BlockTree copy() {
    return new BlockTree(idGenerator, rootId, state.copy());
  }

  // ---- reads ----

  public String rootId() {
    return rootId;
  }

  public Block root() {
    return state.require(rootId);
  }

  public Optional<Block> find(String id) {
    return Optional.ofNullable(state.blocks.get(id));
  }

  /**
   * @throws StructuralException if no block has the given id
   */
  public Block get(String id) {
    return state.require(id);
  }

  public boolean contains(String id) {
    return state.blocks.containsKey(id);
  }

  public List<Block> getChildren(String id) {
    return state.children(id);
  }

  public Optional<String> parentOf(String id) {
    return Optional.ofNullable(state.parents.get(id));
  }

  /** Descendants of a block in depth-first pre-order, excluding the block itself. */
  public List<Block> descendantsOf(String id) {
    return state.descendants(id);
  }

  /** Every block in depth-first pre-order, starting with the root. */
  public List<Block> blocksInOrder() {
    List<Block> ordered = new ArrayList<>();
    ordered.add(root());
    ordered.addAll(state.descendants(rootId));
    return ordered;
  }

  public int size() {
    return state.blocks.size();
  }

  /** Same ids, order, kinds, text and payloads. */
  public boolean contentEquals(BlockTree other) {
    return other != null
        && rootId.equals(other.rootId)
        && blocksInOrder().equals(other.blocksInOrder());
  }

  // ---- listeners ----

  /**
   * Register a listener for committed batches.
   *
   * @return a handle that unregisters the listener when run
   */
  public Runnable addListener(MutationListener listener) {
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  // ---- writes ----

  /**
   * Apply a batch of changes atomically.
   *
   * @param batch operations to apply through the given editor
   * @return the coalesced events of the batch, already delivered to listeners
   * @throws StructuralException if any operation is invalid; nothing is applied in that case
   * @throws IllegalStateException if called while another batch is running
   */
  public List<MutationEvent> mutate(Consumer<Editor> batch) {
    return runBatch(
            editor -> {
              batch.accept(editor);
              return null;
            })
        .events();
  }

  public Block createBlock(BlockType type, String parentId, int index) {
    return createBlock(type, parentId, index, List.of(), null);
  }

  /**
   * Create a block as a single-operation batch.
   *
   * @param index position among the parent's children; negative appends
   */
  public Block createBlock(
      BlockType type, String parentId, int index, List<TextRun> text, BlockPayload payload) {
    return runBatch(editor -> editor.createBlock(type, parentId, index, text, payload)).value();
  }

  /** Remove a block and all of its descendants. */
  public void removeBlock(String id) {
    runBatch(
        editor -> {
          editor.removeBlock(id);
          return null;
        });
  }

  public void moveBlock(String id, String newParentId, int newIndex) {
    runBatch(
        editor -> {
          editor.moveBlock(id, newParentId, newIndex);
          return null;
        });
  }

  public Block updateText(String id, List<TextRun> text) {
    return runBatch(editor -> editor.updateText(id, text)).value();
  }

  public Block updatePayload(String id, BlockPayload payload) {
    return runBatch(editor -> editor.updatePayload(id, payload)).value();
  }

  private <T> BatchResult<T> runBatch(Function<Editor, T> operations) {
    if (batchRunning) {
      throw new IllegalStateException("mutate is not re-entrant: a batch is already running");
    }

    Editor editor = new Editor(state.copy());
    T value;
    batchRunning = true;
    try {
      value = operations.apply(editor);
    } finally {
      batchRunning = false;
    }

    state = editor.working;
    List<MutationEvent> events = editor.events.drain();
    if (!events.isEmpty()) {
      LOGGER.debug("Committed batch: events={}, blocks={}", events.size(), state.blocks.size());
      dispatch(events);
    }
    return new BatchResult<>(value, events);
  }

  private void dispatch(List<MutationEvent> events) {
    for (MutationListener listener : listeners) {
      try {
        listener.onMutations(this, events);
      } catch (RuntimeException e) {
        LOGGER.error("Mutation listener failed: listener={}", listener, e);
      }
    }
  }

  private record BatchResult<T>(T value, List<MutationEvent> events) {}

  /**
   * Operations available inside a {@link #mutate} batch.
   *
   * <p>Reads through the editor see the changes made earlier in the same batch.
   */
  public final class Editor {

    private final State working;
    private final EventLog events = new EventLog();

    private Editor(State working) {
      this.working = working;
    }

    public Block createBlock(BlockType type, String parentId, int index) {
      return createBlock(type, parentId, index, List.of(), null);
    }

    public Block createBlock(
        BlockType type, String parentId, int index, List<TextRun> text, BlockPayload payload) {
      if (type == BlockType.ROOT) {
        throw new StructuralException("A document has exactly one root block");
      }
      Block parent = working.blocks.get(parentId);
      if (parent == null) {
        throw new StructuralException("Parent block not found: " + parentId);
      }
      requireContainment(parent, type);

      String id = idGenerator.get();
      if (working.blocks.containsKey(id)) {
        throw new StructuralException("Generated block id already in use: " + id);
      }

      Block block;
      try {
        block = new Block(id, type, text, payload, null);
      } catch (IllegalArgumentException e) {
        throw new StructuralException(
            "Invalid " + type.wireName() + " block: " + e.getMessage(), e);
      }

      working.blocks.put(id, block);
      working.insertChild(parent.id(), id, index);
      events.record(MutationEvent.created(id));
      events.record(MutationEvent.updated(parent.id()));
      return block;
    }

    public void removeBlock(String id) {
      if (rootId.equals(id)) {
        throw new StructuralException("The root block cannot be removed");
      }
      working.require(id);

      String parentId = working.parents.get(id);
      working.removeChild(parentId, id);

      List<String> doomed = new ArrayList<>();
      doomed.add(id);
      working.descendants(id).forEach(b -> doomed.add(b.id()));
      for (String doomedId : doomed) {
        working.blocks.remove(doomedId);
        working.parents.remove(doomedId);
        events.record(MutationEvent.removed(doomedId));
      }
      events.record(MutationEvent.updated(parentId));
    }

    public void moveBlock(String id, String newParentId, int newIndex) {
      if (rootId.equals(id)) {
        throw new StructuralException("The root block cannot be moved");
      }
      Block block = working.require(id);
      Block newParent = working.blocks.get(newParentId);
      if (newParent == null) {
        throw new StructuralException("Parent block not found: " + newParentId);
      }
      if (id.equals(newParentId) || isAncestor(id, newParentId)) {
        throw new CycleException("Cannot move block " + id + " under its own descendant");
      }
      requireContainment(newParent, block.type());

      String oldParentId = working.parents.get(id);
      working.removeChild(oldParentId, id);
      working.insertChild(newParentId, id, newIndex);
      events.record(MutationEvent.updated(id));
      events.record(MutationEvent.updated(oldParentId));
      events.record(MutationEvent.updated(newParentId));
    }

    public Block updateText(String id, List<TextRun> text) {
      Block block = working.require(id);
      if (!block.type().isTextBearing()) {
        throw new StructuralException(block.type().wireName() + " blocks cannot carry text");
      }
      Block updated = block.withText(text);
      working.blocks.put(id, updated);
      events.record(MutationEvent.updated(id));
      return updated;
    }

    public Block updatePayload(String id, BlockPayload payload) {
      Block block = working.require(id);
      Block updated;
      try {
        updated = block.withPayload(payload);
      } catch (IllegalArgumentException e) {
        throw new StructuralException("Invalid payload for block " + id + ": " + e.getMessage(), e);
      }
      working.blocks.put(id, updated);
      events.record(MutationEvent.updated(id));
      return updated;
    }

    public Block get(String id) {
      return working.require(id);
    }

    public List<Block> getChildren(String id) {
      return working.children(id);
    }

    public String rootId() {
      return rootId;
    }

    private boolean isAncestor(String ancestorId, String id) {
      String current = working.parents.get(id);
      while (current != null) {
        if (current.equals(ancestorId)) {
          return true;
        }
        current = working.parents.get(current);
      }
      return false;
    }

    private void requireContainment(Block parent, BlockType childType) {
      if (!parent.type().canContain(childType)) {
        throw new StructuralException(
            parent.type().wireName() + " cannot contain " + childType.wireName());
      }
    }
  }

  /**
   * Per-batch event accumulator.
   *
   * <p>Keeps at most one event per block id, in order of first occurrence: created+updated stays
   * created, created+removed disappears, updated+removed becomes removed.
   */
  private static final class EventLog {

    private final LinkedHashMap<String, MutationEvent.Type> byId = new LinkedHashMap<>();

    void record(MutationEvent event) {
      String id = event.blockId();
      MutationEvent.Type existing = byId.get(id);
      if (existing == null) {
        byId.put(id, event.type());
        return;
      }
      switch (event.type()) {
        case REMOVED -> {
          if (existing == MutationEvent.Type.CREATED) {
            byId.remove(id);
          } else {
            byId.put(id, MutationEvent.Type.REMOVED);
          }
        }
        case CREATED, UPDATED -> {
          // an earlier CREATED or UPDATED already covers this block
        }
      }
    }

    List<MutationEvent> drain() {
      List<MutationEvent> drained = new ArrayList<>(byId.size());
      byId.forEach((id, type) -> drained.add(new MutationEvent(type, id)));
      byId.clear();
      return List.copyOf(drained);
    }
  }

  /** Mutable block and parent maps; batches operate on a copy. */
  private static final class State {

    private final LinkedHashMap<String, Block> blocks;
    private final Map<String, String> parents;

    State() {
      this.blocks = new LinkedHashMap<>();
      this.parents = new HashMap<>();
    }

    private State(LinkedHashMap<String, Block> blocks, Map<String, String> parents) {
      this.blocks = blocks;
      this.parents = parents;
    }

    State copy() {
      return new State(new LinkedHashMap<>(blocks), new HashMap<>(parents));
    }

    Block require(String id) {
      Block block = id == null ? null : blocks.get(id);
      if (block == null) {
        throw new StructuralException("Block not found: " + id);
      }
      return block;
    }

    List<Block> children(String id) {
      return require(id).children().stream().map(blocks::get).toList();
    }

    List<Block> descendants(String id) {
      List<Block> result = new ArrayList<>();
      collect(require(id), result);
      return result;
    }

    private void collect(Block block, List<Block> out) {
      for (String childId : block.children()) {
        Block child = blocks.get(childId);
        out.add(child);
        collect(child, out);
      }
    }

    void insertChild(String parentId, String childId, int index) {
      Block parent = require(parentId);
      List<String> children = new ArrayList<>(parent.children());
      int position = index < 0 || index > children.size() ? children.size() : index;
      children.add(position, childId);
      blocks.put(parentId, parent.withChildren(children));
      parents.put(childId, parentId);
    }

    void removeChild(String parentId, String childId) {
      Block parent = require(parentId);
      List<String> children = new ArrayList<>(parent.children());
      children.remove(childId);
      blocks.put(parentId, parent.withChildren(children));
      parents.remove(childId);
    }
  }
}
