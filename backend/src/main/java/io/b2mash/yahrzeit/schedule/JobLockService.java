package io.b2mash.yahrzeit.schedule;

import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Cross-instance run-lock. A lease is taken with a compare-and-set on {@code locked_until}, so an
 * instance that dies while holding it blocks the job for at most one lease.
 */
@Service
public class JobLockService {

  private static final Logger log = LoggerFactory.getLogger(JobLockService.class);

  private final JobLockRepository jobLockRepository;
  private final Clock clock;
  private final String owner = "instance-" + UUID.randomUUID();

  public JobLockService(JobLockRepository jobLockRepository, Clock clock) {
    this.jobLockRepository = jobLockRepository;
    this.clock = clock;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public boolean tryAcquire(String jobName, Duration lease) {
    var now = clock.instant();
    boolean acquired = jobLockRepository.tryAcquire(jobName, owner, now.plus(lease), now) == 1;
    if (!acquired) {
      log.info("Lease for job {} is held by another instance", jobName);
    }
    return acquired;
  }

  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void release(String jobName) {
    if (jobLockRepository.release(jobName, owner) == 0) {
      log.warn("Lease for job {} expired before it was released", jobName);
    }
  }
}
