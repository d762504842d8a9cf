package com.chatdigest.backend.digest;

import com.slack.api.model.block.LayoutBlock;
import java.util.List;

public record RenderedDigest(String fallbackText, List<LayoutBlock> blocks) {

  public RenderedDigest {
    blocks = List.copyOf(blocks);
  }
}
