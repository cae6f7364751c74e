package cafe.woden.chatrelay.web;

import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("[chatrelay] bad request: {}", ex.getMessage());
    return respond(HttpStatus.BAD_REQUEST, ex);
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException ex) {
    log.warn("[chatrelay] conflict: {}", ex.getMessage());
    return respond(HttpStatus.CONFLICT, ex);
  }

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(NoSuchElementException ex) {
    log.debug("[chatrelay] not found: {}", ex.getMessage());
    return respond(HttpStatus.NOT_FOUND, ex);
  }

  private static ResponseEntity<ErrorResponse> respond(HttpStatus status, Exception ex) {
    return ResponseEntity.status(status)
        .body(new ErrorResponse(status.value(), status.getReasonPhrase(), ex.getMessage()));
  }
}
