package dev.mass.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Maps exceptions escaping the REST controllers to RFC 9457 Problem Detail responses.
 *
 * <p>Spring MVC exceptions (bean validation failures, unreadable bodies, unsupported methods) keep
 * the status assigned by {@link ResponseEntityExceptionHandler}. {@link IllegalArgumentException}
 * is a 400; anything else is a 500.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by input checks
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(Exception.class)
  ProblemDetail handleUnexpected(Exception ex) {
    log.error("Request failed: {}", ex.getMessage(), ex);
    return ProblemDetail.forStatusAndDetail(
        HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage() != null ? ex.getMessage() : ex.toString());
  }
}
