package io.bms.backend.lease;

/** Lease lifecycle status. Only ACTIVE leases are invoiced. */
public enum LeaseStatus {
  PENDING,
  ACTIVE,
  TERMINATED,
  EXPIRED
}
