package io.b2mash.yahrzeit.calendar;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Thrown when a year table could not be obtained and no last-known-good copy exists. Transient: the
 * sweep leaves the subject untouched and tries again on its next run.
 */
public class DateComputationException extends ErrorResponseException {

  public DateComputationException(String detail, Throwable cause) {
    super(HttpStatus.SERVICE_UNAVAILABLE, createProblem(detail), cause);
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.SERVICE_UNAVAILABLE);
    problem.setTitle("Date computation unavailable");
    problem.setDetail(detail);
    return problem;
  }
}
