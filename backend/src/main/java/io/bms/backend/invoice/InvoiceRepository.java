package io.bms.backend.invoice;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

  @Query(
      """
      SELECT i FROM Invoice i
      WHERE i.leaseId = :leaseId AND i.organizationId = :organizationId
      ORDER BY i.issueDate DESC
      """)
  List<Invoice> findByLeaseIdAndOrganizationId(
      @Param("leaseId") UUID leaseId, @Param("organizationId") String organizationId);

  /** Invoices in one of {@code statuses} whose due date is on or before {@code asOf}. */
  @Query(
      """
      SELECT i FROM Invoice i
      WHERE i.organizationId = :organizationId
        AND i.status IN :statuses
        AND i.dueDate <= :asOf
      ORDER BY i.dueDate
      """)
  List<Invoice> findOverdueCandidates(
      @Param("organizationId") String organizationId,
      @Param("statuses") Collection<InvoiceStatus> statuses,
      @Param("asOf") LocalDate asOf);
}
