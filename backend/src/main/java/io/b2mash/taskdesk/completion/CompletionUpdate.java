package io.b2mash.taskdesk.completion;

/**
 * Desired completion state of one {@code (clientId, periodKey)} cell in a batch. ARN fields are
 * only read when the entry marks the period completed on a task that requires an ARN.
 */
public record CompletionUpdate(
    String clientId, String periodKey, boolean completed, String arnNumber, String arnName) {

  public static CompletionUpdate of(String clientId, String periodKey, boolean completed) {
    return new CompletionUpdate(clientId, periodKey, completed, null, null);
  }

  String cellKey() {
    return clientId + "|" + periodKey;
  }
}
