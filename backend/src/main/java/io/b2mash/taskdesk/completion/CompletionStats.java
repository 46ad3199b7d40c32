package io.b2mash.taskdesk.completion;

/**
 * Completed visible periods of one client.
 *
 * @param percentage {@code round(100 * completed / total)}, 0 when there are no visible periods
 */
public record CompletionStats(int completed, int total, int percentage) {

  public static CompletionStats of(int completed, int total) {
    int percentage = total == 0 ? 0 : (int) Math.round(100.0 * completed / total);
    return new CompletionStats(completed, total, percentage);
  }
}
