package io.b2mash.yahrzeit.audit;

import java.util.List;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

/** Records and queries the outbound event history. */
public interface AuditService {

  /**
   * Records a single audit event within the current transaction, if there is one. If that
   * transaction rolls back, the audit event is rolled back too.
   */
  void log(AuditEventRecord record);

  /** Matching events, newest first. */
  Page<AuditEvent> findEvents(AuditEventFilter filter, Pageable pageable);

  List<AuditEventRepository.EventTypeCount> countEventsByType();
}
