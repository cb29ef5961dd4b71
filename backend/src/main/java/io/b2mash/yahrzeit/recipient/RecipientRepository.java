package io.b2mash.yahrzeit.recipient;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

public interface RecipientRepository extends JpaRepository<Recipient, UUID> {

  List<Recipient> findBySubjectIdOrderByCreatedAt(UUID subjectId);

  List<Recipient> findBySubjectIdAndActiveTrueAndOptedOutFalse(UUID subjectId);

  long countBySubjectId(UUID subjectId);

  boolean existsBySubjectIdAndChannelKindAndAddress(
      UUID subjectId, ChannelKind channelKind, String address);

  /** Largest per-recipient lead override among eligible recipients, or null if none is set. */
  @Query(
      "SELECT MAX(r.leadDays) FROM Recipient r WHERE r.active = true AND r.optedOut = false")
  Integer findMaxLeadDays();
}
