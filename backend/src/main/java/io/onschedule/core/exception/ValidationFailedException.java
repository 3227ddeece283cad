package io.onschedule.core.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A request that is well-formed but violates a binding rule (missing date, template, etc.). */
public class ValidationFailedException extends ErrorResponseException {

  public ValidationFailedException(String detail) {
    this("Validation failed", detail);
  }

  public ValidationFailedException(String title, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(title, detail), null);
  }

  private static ProblemDetail createProblem(String title, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle(title);
    problem.setDetail(detail);
    return problem;
  }
}
