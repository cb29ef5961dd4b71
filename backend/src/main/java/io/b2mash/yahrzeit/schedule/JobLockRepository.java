package io.b2mash.yahrzeit.schedule;

import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface JobLockRepository extends JpaRepository<JobLock, String> {

  @Modifying
  @Query(
      """
      UPDATE JobLock l SET l.lockedUntil = :until, l.lockedBy = :owner
      WHERE l.name = :name AND (l.lockedUntil IS NULL OR l.lockedUntil < :now)
      """)
  int tryAcquire(
      @Param("name") String name,
      @Param("owner") String owner,
      @Param("until") Instant until,
      @Param("now") Instant now);

  @Modifying
  @Query(
      """
      UPDATE JobLock l SET l.lockedUntil = NULL, l.lockedBy = NULL
      WHERE l.name = :name AND l.lockedBy = :owner
      """)
  int release(@Param("name") String name, @Param("owner") String owner);
}
