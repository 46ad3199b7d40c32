package io.b2mash.taskdesk.audit;

import io.b2mash.taskdesk.member.MemberContext;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;

/**
 * Builds an {@link AuditEventRecord}. The actor comes from {@link MemberContext} unless set
 * explicitly; the source is API inside a request and INTERNAL otherwise.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("recurring_task.paused")
 *     .entityType("recurring_task")
 *     .entityId(task.getId())
 *     .details(Map.of("title", task.getTitle()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private String actorId;
  private boolean actorIdExplicitlySet;
  private Map<String, Object> details;

  private AuditEventBuilder() {}

  public static AuditEventBuilder builder() {
    return new AuditEventBuilder();
  }

  public AuditEventBuilder eventType(String eventType) {
    this.eventType = eventType;
    return this;
  }

  public AuditEventBuilder entityType(String entityType) {
    this.entityType = entityType;
    return this;
  }

  public AuditEventBuilder entityId(UUID entityId) {
    this.entityId = entityId;
    return this;
  }

  public AuditEventBuilder actorId(String actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    String resolvedActorId = actorIdExplicitlySet ? actorId : MemberContext.getCurrentMemberId();
    String actorType = resolvedActorId != null ? "USER" : "SYSTEM";
    String source = RequestContextHolder.getRequestAttributes() != null ? "API" : "INTERNAL";
    return new AuditEventRecord(
        eventType, entityType, entityId, resolvedActorId, actorType, source, details);
  }
}
