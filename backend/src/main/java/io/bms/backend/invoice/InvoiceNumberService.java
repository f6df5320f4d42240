package io.bms.backend.invoice;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Generates sequential invoice numbers per organization and calendar year using a counter table
 * with row-level locking.
 *
 * <ul>
 *   <li>The counter row for a year is created by the first invoice of that year
 *   <li>Numbers are gap-free: the UPSERT joins the caller's transaction, so a rolled-back invoice
 *       releases its number
 *   <li>Format: "INV-" + year + "-" + zero-padded 3-digit sequence ("INV-2024-001"); sequences
 *       past 999 simply grow wider
 * </ul>
 */
@Service
public class InvoiceNumberService {

  @PersistenceContext private EntityManager entityManager;

  /**
   * Assigns the next invoice number for the organization in the given year.
   *
   * <p>INSERT ... ON CONFLICT DO UPDATE ... RETURNING is atomic: concurrent callers serialize on
   * the counter row.
   */
  @Transactional
  public String assignNumber(String organizationId, int year) {
    var result =
        entityManager
            .createNativeQuery(
                "INSERT INTO invoice_counters (id, organization_id, year, next_number)"
                    + " VALUES (gen_random_uuid(), :organizationId, :year, 2)"
                    + " ON CONFLICT (organization_id, year)"
                    + " DO UPDATE SET next_number = invoice_counters.next_number + 1"
                    + " RETURNING next_number - 1")
            .setParameter("organizationId", organizationId)
            .setParameter("year", year)
            .getSingleResult();

    int number = ((Number) result).intValue();
    return format(year, number);
  }

  static String format(int year, int number) {
    return String.format("INV-%d-%03d", year, number);
  }
}
