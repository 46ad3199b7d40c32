package io.b2mash.taskdesk.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * Malformed input that passed request-level validation but violates a domain rule. The offending
 * field is exposed both on the exception and as the {@code field} property of the problem body.
 */
public class InvalidArgumentException extends ErrorResponseException {

  private final String field;

  public InvalidArgumentException(String field, String detail) {
    super(HttpStatus.BAD_REQUEST, createProblem(field, detail), null);
    this.field = field;
  }

  public String getField() {
    return field;
  }

  private static ProblemDetail createProblem(String field, String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid argument");
    problem.setDetail(detail);
    problem.setProperty("field", field);
    return problem;
  }
}
