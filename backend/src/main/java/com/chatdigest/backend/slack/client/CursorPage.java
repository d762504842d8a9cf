package com.chatdigest.backend.slack.client;

import java.util.List;
import org.springframework.util.StringUtils;

/** One page of a cursor-paginated listing. A blank {@code nextCursor} marks the last page. */
public record CursorPage<T>(List<T> items, String nextCursor) {

  public CursorPage {
    items = items == null ? List.of() : List.copyOf(items);
  }

  public boolean hasMore() {
    return StringUtils.hasText(nextCursor);
  }
}
