package io.b2mash.yahrzeit.schedule;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** Lease row for a periodic job; one row per job, seeded by migration. */
@Entity
@Table(name = "job_locks")
public class JobLock {

  @Id
  @Column(name = "name", length = 100)
  private String name;

  @Column(name = "locked_until")
  private Instant lockedUntil;

  @Column(name = "locked_by", length = 200)
  private String lockedBy;

  protected JobLock() {}

  public String getName() {
    return name;
  }

  public Instant getLockedUntil() {
    return lockedUntil;
  }

  public String getLockedBy() {
    return lockedBy;
  }
}
