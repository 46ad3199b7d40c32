package io.b2mash.taskdesk.team;

import io.b2mash.taskdesk.exception.InvalidArgumentException;
import io.b2mash.taskdesk.recurringtask.RecurringTask;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Decides which of a task's clients a viewer may act on, and validates client assignments. */
@Component
public class TeamMemberMappingResolver {

  private static final Logger log = LoggerFactory.getLogger(TeamMemberMappingResolver.class);

  /**
   * Resolves the clients {@code viewerId} may act on for {@code task}:
   *
   * <ol>
   *   <li>the viewer's own mapping entry, if the task has one for them;
   *   <li>every contact, if the task has neither mappings nor a team;
   *   <li>every contact, if the task is team-scoped and the viewer is privileged;
   *   <li>nothing otherwise.
   * </ol>
   *
   * The returned set preserves assignment (or contact) order.
   */
  public Set<String> resolveVisibleClients(
      RecurringTask task, String viewerId, boolean viewerIsPrivileged) {
    List<TeamMemberMapping> mappings = task.getTeamMemberMappings();

    if (!mappings.isEmpty() && viewerId != null) {
      var own = mappings.stream().filter(m -> viewerId.equals(m.userId())).findFirst();
      if (own.isPresent()) {
        return new LinkedHashSet<>(own.get().clientIds());
      }
    }

    if (mappings.isEmpty() && task.getTeamId() == null) {
      return new LinkedHashSet<>(task.getContactIds());
    }

    if (task.getTeamId() != null && viewerIsPrivileged) {
      return new LinkedHashSet<>(task.getContactIds());
    }

    log.debug("Viewer {} has no clients on recurring task {}", viewerId, task.getId());
    return Set.of();
  }

  /**
   * Checks that every client referenced by every mapping is one of {@code contactIds}. A client
   * mapped to more than one member is accepted and logged.
   *
   * @throws InvalidArgumentException on a null mapping, a null or blank client id, or naming the
   *     first client outside {@code contactIds}
   */
  public void validateMapping(List<TeamMemberMapping> mappings, Collection<String> contactIds) {
    if (mappings == null || mappings.isEmpty()) {
      return;
    }
    Set<String> contacts = new HashSet<>(contactIds);
    Map<String, String> owners = new HashMap<>();
    for (TeamMemberMapping mapping : mappings) {
      if (mapping == null) {
        throw new InvalidArgumentException(
            "teamMemberMappings", "Team member mapping entries must not be null");
      }
      for (String clientId : mapping.clientIds()) {
        if (clientId == null || clientId.isBlank()) {
          throw new InvalidArgumentException(
              "teamMemberMappings.clientIds",
              "Mapping of member %s contains a blank client id".formatted(mapping.userId()));
        }
        if (!contacts.contains(clientId)) {
          throw new InvalidArgumentException(
              "teamMemberMappings",
              "Client %s mapped to member %s is not one of the task's contacts"
                  .formatted(clientId, mapping.userId()));
        }
        String previous = owners.putIfAbsent(clientId, mapping.userId());
        if (previous != null && !previous.equals(mapping.userId())) {
          log.warn(
              "Client {} is mapped to both {} and {}", clientId, previous, mapping.userId());
        }
      }
    }
  }
}
