package io.b2mash.b2b.contractassembly.audit;

import io.b2mash.b2b.contractassembly.multitenancy.RequestScopes;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder for {@link AuditEventRecord}. Tenant, actor, source, IP address and user agent are taken
 * from {@link RequestScopes} and the current HTTP request unless set explicitly.
 *
 * <pre>{@code
 * auditService.log(
 *     AuditEventBuilder.builder()
 *         .eventType("version.submitted")
 *         .entityType("clause_version")
 *         .entityId(version.getId())
 *         .details(Map.of("reviewerId", reviewerId.toString()))
 *         .build());
 * }</pre>
 */
public class AuditEventBuilder {

  private static final int MAX_USER_AGENT_LENGTH = 500;

  private String eventType;
  private String entityType;
  private UUID entityId;
  private String tenantId;
  private UUID actorId;
  private Map<String, Object> details;

  private boolean tenantIdExplicitlySet;
  private boolean actorIdExplicitlySet;

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

  public AuditEventBuilder tenantId(String tenantId) {
    this.tenantId = tenantId;
    this.tenantIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    this.actorIdExplicitlySet = true;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    String resolvedTenantId = tenantIdExplicitlySet ? tenantId : RequestScopes.getTenantIdOrNull();
    UUID resolvedActorId = actorIdExplicitlySet ? actorId : RequestScopes.getActorIdOrNull();
    String actorType = resolvedActorId != null ? "USER" : "SYSTEM";

    HttpServletRequest request = resolveHttpRequest();
    String source = request != null ? "API" : "INTERNAL";

    String ipAddress = null;
    String userAgent = null;
    if (request != null) {
      ipAddress = request.getRemoteAddr();
      String ua = request.getHeader("User-Agent");
      if (ua != null && ua.length() > MAX_USER_AGENT_LENGTH) {
        ua = ua.substring(0, MAX_USER_AGENT_LENGTH);
      }
      userAgent = ua;
    }

    return new AuditEventRecord(
        eventType,
        entityType,
        entityId,
        resolvedTenantId,
        resolvedActorId,
        actorType,
        source,
        ipAddress,
        userAgent,
        details);
  }

  private static HttpServletRequest resolveHttpRequest() {
    var attrs = RequestContextHolder.getRequestAttributes();
    if (attrs instanceof ServletRequestAttributes servletAttrs) {
      return servletAttrs.getRequest();
    }
    return null;
  }
}
