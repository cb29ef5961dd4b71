package io.b2mash.yahrzeit.subject;

import jakarta.persistence.LockModeType;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SubjectRepository extends JpaRepository<Subject, UUID> {

  /** Live subjects, stale ones included, with an occurrence on or before {@code horizon}. */
  @Query(
      """
      SELECT s.id FROM Subject s
      WHERE s.deleted = false AND s.nextOccurrence <= :horizon
      ORDER BY s.nextOccurrence
      """)
  List<UUID> findIdsDueForSweep(@Param("horizon") LocalDate horizon);

  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT s FROM Subject s WHERE s.id = :id")
  Optional<Subject> findByIdForUpdate(@Param("id") UUID id);
}
