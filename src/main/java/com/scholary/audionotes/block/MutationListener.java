package com.scholary.audionotes.block;

import java.util.List;

/**
 * Observer of committed mutation batches.
 *
 * <p>Called synchronously on the editing thread after the batch is applied; the tree already
 * reflects every event in the list.
 */
@FunctionalInterface
public interface MutationListener {

  void onMutations(BlockTree tree, List<MutationEvent> events);
}
