package io.chatpad.pilot.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * The principal is authenticated but resolves to no account: it neither owns a subscription nor
 * belongs to a team. Distinct from {@link ForbiddenException} because platform-level operations
 * (accepting an invitation, reading public content) remain valid for such a principal.
 */
public class NoAccountContextException extends ErrorResponseException {

  public NoAccountContextException(UUID principalId) {
    super(HttpStatus.CONFLICT, createProblem(principalId), null);
  }

  private static ProblemDetail createProblem(UUID principalId) {
    var problem = ProblemDetail.forStatus(HttpStatus.CONFLICT);
    problem.setTitle("No account context");
    problem.setDetail(
        "Principal " + principalId + " has no subscription and no team membership");
    return problem;
  }
}
