package com.scholary.typesetter.api;

import com.scholary.typesetter.karaoke.timing.UnsupportedTimingFormatException;
import com.scholary.typesetter.service.PaginationSupersededException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps failures to HTTP responses. */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(UnsupportedTimingFormatException.class)
  public ResponseEntity<ApiError> handleUnsupportedFormat(
      UnsupportedTimingFormatException e, HttpServletRequest request) {
    LOGGER.info("Rejected timing file: {}", e.getMessage());
    return error(HttpStatus.UNSUPPORTED_MEDIA_TYPE, e.getMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException e, HttpServletRequest request) {
    String message =
        e.getBindingResult().getFieldErrors().stream()
            .map(field -> field.getField() + " " + field.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return error(HttpStatus.BAD_REQUEST, message, request);
  }

  @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
  public ResponseEntity<ApiError> handleBadRequest(Exception e, HttpServletRequest request) {
    return error(HttpStatus.BAD_REQUEST, e.getMessage(), request);
  }

  @ExceptionHandler(PaginationSupersededException.class)
  public ResponseEntity<ApiError> handleSuperseded(
      PaginationSupersededException e, HttpServletRequest request) {
    return error(HttpStatus.CONFLICT, e.getMessage(), request);
  }

  private static ResponseEntity<ApiError> error(
      HttpStatus status, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            new ApiError(
                status.value(),
                status.getReasonPhrase(),
                message,
                request.getRequestURI(),
                Instant.now()));
  }
}
