package io.b2mash.taskdesk.config;

import java.util.List;
import java.util.Locale;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Configuration properties for the recurring task engine.
 *
 * @param privilegedRoles member roles that see every client of a team-scoped task
 * @param resumeCatchUpLimit maximum number of elapsed periods skipped when a paused task resumes
 * @param arnLength exact number of digits an ARN must have on tasks that require one
 */
@ConfigurationProperties(prefix = "taskdesk.recurring")
public record RecurringTaskProperties(
    @DefaultValue({"admin", "manager"}) List<String> privilegedRoles,
    @DefaultValue("1000") int resumeCatchUpLimit,
    @DefaultValue("15") int arnLength) {

  public RecurringTaskProperties {
    privilegedRoles =
        privilegedRoles.stream().map(role -> role.toLowerCase(Locale.ROOT)).toList();
  }

  public static RecurringTaskProperties defaults() {
    return new RecurringTaskProperties(List.of("admin", "manager"), 1000, 15);
  }

  public boolean isPrivileged(String role) {
    return role != null && privilegedRoles.contains(role.toLowerCase(Locale.ROOT));
  }
}
