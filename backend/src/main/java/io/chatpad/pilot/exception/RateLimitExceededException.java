package io.chatpad.pilot.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

public class RateLimitExceededException extends ErrorResponseException {

  public RateLimitExceededException(String detail) {
    super(HttpStatus.TOO_MANY_REQUESTS, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.TOO_MANY_REQUESTS);
    problem.setTitle("Rate limit exceeded");
    problem.setDetail(detail);
    return problem;
  }
}
