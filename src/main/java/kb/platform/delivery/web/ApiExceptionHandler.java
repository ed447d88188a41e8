package kb.platform.delivery.web;

import kb.core.errors.AuthenticationException;
import kb.core.errors.PreconditionException;
import kb.core.errors.RemoteStoreException;
import kb.core.errors.ResourceNotFoundException;
import kb.core.errors.UnsupportedFormatException;
import kb.core.errors.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler({
    ValidationException.class,
    UnsupportedFormatException.class,
    PreconditionException.class
  })
  public ResponseEntity<ErrorResponse> badRequest(RuntimeException e) {
    return error(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestPartException.class})
  public ResponseEntity<ErrorResponse> malformedRequest(Exception e) {
    return error(HttpStatus.BAD_REQUEST, "Malformed request: " + e.getMessage());
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<ErrorResponse> unauthorized(AuthenticationException e) {
    return error(HttpStatus.UNAUTHORIZED, e.getMessage());
  }

  @ExceptionHandler(ResourceNotFoundException.class)
  public ResponseEntity<ErrorResponse> notFound(ResourceNotFoundException e) {
    return error(HttpStatus.NOT_FOUND, e.getMessage());
  }

  @ExceptionHandler(RemoteStoreException.class)
  public ResponseEntity<ErrorResponse> badGateway(RemoteStoreException e) {
    LOGGER.warn("Remote service call failed: {}", e.getMessage());
    return error(HttpStatus.BAD_GATEWAY, e.getMessage());
  }

  private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(message));
  }
}
