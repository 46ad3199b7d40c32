package io.b2mash.taskdesk.completion;

import io.b2mash.taskdesk.recurrence.FiscalPeriod;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unsaved client-by-period completion checkboxes. Built from {@link
 * CompletionTracker#loadCompletions}, edited with {@link #toggle}, and written back in one batch
 * with {@link #toUpdates}. Not thread-safe; one grid belongs to one editing session.
 */
public class CompletionGrid {

  private final Map<String, Set<String>> completedByClient = new LinkedHashMap<>();

  public CompletionGrid(Map<String, Set<String>> completions) {
    completions.forEach(
        (clientId, keys) -> completedByClient.put(clientId, new LinkedHashSet<>(keys)));
  }

  /**
   * Flips the completion of one cell.
   *
   * @return the new state of the cell
   */
  public boolean toggle(String clientId, String periodKey) {
    Set<String> keys = completedByClient.computeIfAbsent(clientId, id -> new LinkedHashSet<>());
    if (keys.remove(periodKey)) {
      return false;
    }
    keys.add(periodKey);
    return true;
  }

  public boolean isCompleted(String clientId, String periodKey) {
    return completedByClient.getOrDefault(clientId, Set.of()).contains(periodKey);
  }

  public Set<String> completedPeriods(String clientId) {
    return Set.copyOf(completedByClient.getOrDefault(clientId, Set.of()));
  }

  /**
   * One update per {@code (client, period)} cell of the given clients and periods, carrying the
   * grid's current state. Cells outside those clients and periods are left out, so saving the
   * result leaves them untouched.
   */
  public List<CompletionUpdate> toUpdates(
      Collection<String> clientIds, List<FiscalPeriod> periods) {
    List<CompletionUpdate> updates = new ArrayList<>(clientIds.size() * periods.size());
    for (FiscalPeriod period : periods) {
      for (String clientId : clientIds) {
        updates.add(
            CompletionUpdate.of(clientId, period.key(), isCompleted(clientId, period.key())));
      }
    }
    return updates;
  }

  public Map<String, Set<String>> snapshot() {
    Map<String, Set<String>> copy = new LinkedHashMap<>();
    completedByClient.forEach((clientId, keys) -> copy.put(clientId, Set.copyOf(keys)));
    return copy;
  }
}
