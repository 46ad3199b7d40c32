package io.b2mash.taskdesk.team;

import io.b2mash.taskdesk.exception.InvalidArgumentException;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Assignment of a subset of a task's clients to one team member.
 *
 * @param userId member the clients are assigned to
 * @param userName display name captured when the mapping was made
 * @param clientIds clients this member is responsible for, in assignment order
 */
public record TeamMemberMapping(
    @NotBlank String userId, String userName, List<@NotBlank String> clientIds) {

  public TeamMemberMapping {
    if (userId == null || userId.isBlank()) {
      throw new InvalidArgumentException(
          "teamMemberMappings.userId", "Team member mapping requires a user id");
    }
    // null entries are kept so validation can name them
    clientIds =
        clientIds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(clientIds));
  }
}
