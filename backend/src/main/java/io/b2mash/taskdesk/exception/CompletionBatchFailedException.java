package io.b2mash.taskdesk.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A completion batch could not be written. The batch is atomic, so no entry of it was applied and
 * no per-entry diagnostics are reported.
 */
public class CompletionBatchFailedException extends ErrorResponseException {

  public CompletionBatchFailedException(UUID taskId, int entryCount, Throwable cause) {
    super(HttpStatus.CONFLICT, createProblem(taskId, entryCount), cause);
  }

  private static ProblemDetail createProblem(UUID taskId, int entryCount) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("Completion batch failed");
    problem.setDetail(
        "None of the %d completion entries for recurring task %s were saved. Please retry."
            .formatted(entryCount, taskId));
    problem.setProperty("taskId", taskId);
    return problem;
  }
}
