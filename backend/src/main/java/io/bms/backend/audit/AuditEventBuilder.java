package io.bms.backend.audit;

import java.util.Map;
import java.util.UUID;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Builder that constructs an {@link AuditEventRecord}. The source is resolved from the current
 * thread: INTERNAL inside an HTTP request (the internal billing API), SCHEDULED otherwise.
 *
 * <pre>{@code
 * AuditEventRecord record = AuditEventBuilder.builder()
 *     .eventType("invoice.generated")
 *     .entityType("invoice")
 *     .entityId(invoice.getId())
 *     .organizationId(invoice.getOrganizationId())
 *     .details(Map.of("invoice_number", invoice.getInvoiceNumber()))
 *     .build();
 * }</pre>
 */
public class AuditEventBuilder {

  private String eventType;
  private String entityType;
  private UUID entityId;
  private String organizationId;
  private String source;
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

  public AuditEventBuilder organizationId(String organizationId) {
    this.organizationId = organizationId;
    return this;
  }

  public AuditEventBuilder source(String source) {
    this.source = source;
    return this;
  }

  public AuditEventBuilder details(Map<String, Object> details) {
    this.details = details;
    return this;
  }

  public AuditEventRecord build() {
    String resolvedSource = source;
    if (resolvedSource == null) {
      resolvedSource = inHttpRequest() ? "INTERNAL" : "SCHEDULED";
    }
    return new AuditEventRecord(
        eventType, entityType, entityId, organizationId, "SYSTEM", resolvedSource, details);
  }

  private static boolean inHttpRequest() {
    return RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes;
  }
}
