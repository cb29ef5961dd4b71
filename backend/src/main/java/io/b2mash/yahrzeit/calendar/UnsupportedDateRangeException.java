package io.b2mash.yahrzeit.calendar;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when a date falls outside the Hebrew years this service can convert. */
public class UnsupportedDateRangeException extends ErrorResponseException {

  public static final int MIN_YEAR = 5000;
  public static final int MAX_YEAR = 5999;

  public UnsupportedDateRangeException(String detail) {
    super(HttpStatus.UNPROCESSABLE_ENTITY, createProblem(detail), null);
  }

  public static UnsupportedDateRangeException forHebrewYear(int year) {
    return new UnsupportedDateRangeException(
        "Hebrew year "
            + year
            + " is outside the supported range "
            + MIN_YEAR
            + "-"
            + MAX_YEAR);
  }

  @Override
  public String getMessage() {
    return getBody().getDetail();
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNPROCESSABLE_ENTITY);
    problem.setTitle("Unsupported date range");
    problem.setDetail(detail);
    return problem;
  }
}
