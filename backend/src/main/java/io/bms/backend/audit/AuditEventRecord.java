package io.bms.backend.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO passed to {@link AuditService#log(AuditEventRecord)}. Constructed by {@link
 * AuditEventBuilder}.
 *
 * @param eventType free-form event type following {@code {entity}.{action}} convention
 * @param entityType the kind of entity being audited (e.g., "invoice", "lease")
 * @param entityId ID of the affected entity
 * @param organizationId organization owning the entity
 * @param actorType SYSTEM for billing runs
 * @param source origin of the action: INTERNAL (internal API) or SCHEDULED
 * @param details key field values as JSONB; nullable
 */
public record AuditEventRecord(
    String eventType,
    String entityType,
    UUID entityId,
    String organizationId,
    String actorType,
    String source,
    Map<String, Object> details) {}
