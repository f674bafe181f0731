package com.scholary.audionotes.api;

import com.scholary.audionotes.block.Block;
import java.util.List;

/**
 * A block as returned by the API.
 *
 * @param type snapshot kind name
 * @param text plain text, formats dropped
 */
public record BlockResponse(String id, String type, String text, List<String> children) {

  static BlockResponse from(Block block) {
    return new BlockResponse(
        block.id(), block.type().wireName(), block.plainText(), block.children());
  }
}
