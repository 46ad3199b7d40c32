package io.b2mash.taskdesk.completion;

/**
 * Outcome of a saved completion batch.
 *
 * @param entries entries in the batch
 * @param completed entries that moved a period to completed
 * @param cleared entries that moved a period back to not completed
 */
public record CompletionBatchResult(int entries, int completed, int cleared) {

  public int unchanged() {
    return entries - completed - cleared;
  }
}
