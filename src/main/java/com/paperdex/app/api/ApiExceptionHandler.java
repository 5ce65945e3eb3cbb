package com.paperdex.app.api;

import com.paperdex.app.repository.PaperStoreException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/** Maps read API failures to {@code {"error": ...}} bodies. Internal detail is only logged. */
@Log4j2
@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(InvalidQueryException.class)
  public ResponseEntity<ApiError> invalidQuery(InvalidQueryException e) {
    return error(HttpStatus.BAD_REQUEST, e.getMessage());
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiError> constraintViolation(ConstraintViolationException e) {
    String reason =
        e.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .sorted()
            .findFirst()
            .orElse("invalid request");
    return error(HttpStatus.BAD_REQUEST, reason);
  }

  @ExceptionHandler(HandlerMethodValidationException.class)
  public ResponseEntity<ApiError> methodValidation(HandlerMethodValidationException e) {
    String reason =
        e.getAllValidationResults().stream()
            .flatMap(r -> r.getResolvableErrors().stream())
            .map(MessageSourceResolvable::getDefaultMessage)
            .filter(Objects::nonNull)
            .sorted()
            .findFirst()
            .orElse("invalid request");
    return error(HttpStatus.BAD_REQUEST, reason);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiError> typeMismatch(MethodArgumentTypeMismatchException e) {
    return error(HttpStatus.BAD_REQUEST, "invalid " + e.getName());
  }

  @ExceptionHandler(MissingServletRequestParameterException.class)
  public ResponseEntity<ApiError> missingParameter(MissingServletRequestParameterException e) {
    return error(HttpStatus.BAD_REQUEST, "missing " + e.getParameterName());
  }

  @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
  public ResponseEntity<ApiError> notFound(Exception e) {
    return error(HttpStatus.NOT_FOUND, "not found");
  }

  @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
  public ResponseEntity<ApiError> methodNotAllowed(HttpRequestMethodNotSupportedException e) {
    return error(HttpStatus.METHOD_NOT_ALLOWED, "method not allowed");
  }

  @ExceptionHandler(PaperStoreException.class)
  public ResponseEntity<ApiError> storeFailure(PaperStoreException e) {
    log.error("api.storeFailure operation={} key={}", e.getOperation(), e.getKey(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "server error");
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> unexpected(Exception e) {
    log.error("api.unexpected msg={}", e.getMessage(), e);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "server error");
  }

  private static ResponseEntity<ApiError> error(HttpStatus status, String reason) {
    return ResponseEntity.status(status).body(new ApiError(reason));
  }
}
