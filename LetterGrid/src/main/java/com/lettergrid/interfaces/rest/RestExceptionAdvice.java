package com.lettergrid.interfaces.rest;

import com.lettergrid.domain.InvariantViolation;
import com.lettergrid.dto.ErrorMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class RestExceptionAdvice {
  private static final Logger log = LoggerFactory.getLogger(RestExceptionAdvice.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorMessage onInvalid(MethodArgumentNotValidException e) {
    FieldError field = e.getBindingResult().getFieldError();
    String message =
        field != null
            ? field.getField() + ": " + field.getDefaultMessage()
            : e.getBindingResult().getAllErrors().get(0).getDefaultMessage();
    return new ErrorMessage("invalid_request", message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  @ResponseStatus(HttpStatus.BAD_REQUEST)
  public ErrorMessage onUnreadable(HttpMessageNotReadableException e) {
    return new ErrorMessage("invalid_request", "Malformed request body");
  }

  @ExceptionHandler(InvariantViolation.class)
  @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
  public ErrorMessage onInvariant(InvariantViolation e) {
    log.error("Request aborted by invariant violation", e);
    return new ErrorMessage("internal", "Internal state error");
  }
}
