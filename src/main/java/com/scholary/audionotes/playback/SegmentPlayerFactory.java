package com.scholary.audionotes.playback;

import com.scholary.audionotes.block.BlockPayload;
import com.scholary.audionotes.reference.PlayableHandleResolver;
import java.net.URI;

/**
 * Opens players for audio blocks.
 *
 * <p>The host supplies the {@link AudioSourceFactory}, so this is built by the host rather than
 * injected. Resolution and source creation failures come back as a player in {@link
 * PlayerState#ERROR}; opening never throws.
 */
public class SegmentPlayerFactory {

  private final PlayableHandleResolver handleResolver;
  private final AudioSourceFactory sourceFactory;
  private final long skipStepMs;

  public SegmentPlayerFactory(
      PlayableHandleResolver handleResolver, AudioSourceFactory sourceFactory, long skipStepMs) {
    this.handleResolver = handleResolver;
    this.sourceFactory = sourceFactory;
    this.skipStepMs = skipStepMs;
  }

  /**
   * Resolve the block's recording and load it with the block's bounds.
   *
   * @param audio payload of an audio block
   * @return a loading player, or one in ERROR
   */
  public SegmentPlayer open(BlockPayload.Audio audio) {
    SegmentPlayer player = new SegmentPlayer(audio.recordingId(), skipStepMs);
    AudioSource source;
    try {
      URI handle = handleResolver.resolvePlayableHandle(audio.filePath());
      source = sourceFactory.create(handle);
    } catch (SourceLoadException e) {
      player.loadFailed(e.getMessage());
      return player;
    }
    player.load(source, audio.startOffsetMs(), audio.endOffsetMs());
    return player;
  }
}
