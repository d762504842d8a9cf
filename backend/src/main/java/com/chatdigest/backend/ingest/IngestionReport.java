package com.chatdigest.backend.ingest;

/** Totals of one ingestion run across all conversations. */
public record IngestionReport(
    int conversationsSeen,
    int conversationsIngested,
    int conversationsSkipped,
    int messagesProcessed,
    int messagesCreated,
    int messagesUpdated,
    int messagesUnchanged,
    int messagesFailed) {

  public static IngestionReport empty() {
    return new IngestionReport(0, 0, 0, 0, 0, 0, 0, 0);
  }

  IngestionReport plus(IngestionReport other) {
    return new IngestionReport(
        conversationsSeen + other.conversationsSeen,
        conversationsIngested + other.conversationsIngested,
        conversationsSkipped + other.conversationsSkipped,
        messagesProcessed + other.messagesProcessed,
        messagesCreated + other.messagesCreated,
        messagesUpdated + other.messagesUpdated,
        messagesUnchanged + other.messagesUnchanged,
        messagesFailed + other.messagesFailed);
  }

  static IngestionReport skipped() {
    return new IngestionReport(1, 0, 1, 0, 0, 0, 0, 0);
  }
}
