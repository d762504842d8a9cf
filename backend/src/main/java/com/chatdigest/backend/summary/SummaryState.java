package com.chatdigest.backend.summary;

/**
 * Progress of one generation run. {@code EMPTY} and {@code PERSISTED} are terminal; only {@code
 * PERSISTED} leaves a row behind.
 */
public enum SummaryState {
  IDLE,
  FETCHING,
  GENERATING,
  PERSISTED,
  EMPTY
}
