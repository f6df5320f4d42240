package io.bms.backend.lease;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface LeaseRepository extends JpaRepository<Lease, UUID> {

  Optional<Lease> findByIdAndOrganizationId(UUID id, String organizationId);

  /** Leases of an organization whose next billing period has ended on or before {@code asOf}. */
  @Query(
      """
      SELECT l FROM Lease l
      WHERE l.organizationId = :organizationId
        AND l.status = :status
        AND l.nextInvoiceDate IS NOT NULL
        AND l.nextInvoiceDate <= :asOf
      ORDER BY l.nextInvoiceDate, l.createdAt
      """)
  List<Lease> findDueForInvoicing(
      @Param("organizationId") String organizationId,
      @Param("status") LeaseStatus status,
      @Param("asOf") LocalDate asOf);

  /** Organizations owning at least one lease. Used by the invoicing scheduler. */
  @Query("SELECT DISTINCT l.organizationId FROM Lease l ORDER BY l.organizationId")
  List<String> findDistinctOrganizationIds();
}
