/*
 * どこで: Dispatch API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: 運用 API のエラー応答を統一するため
 */
package com.example.dispatch.api;

import com.example.dispatch.service.DeadLetterNotFoundException;
import com.example.dispatch.service.DuplicateJobException;
import com.example.dispatch.service.InvalidJobStateException;
import com.example.dispatch.service.JobNotFoundException;
import com.example.dispatch.service.ScheduleNotFoundException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleJobNotFound(JobNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.JOB_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(DeadLetterNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleDeadLetterNotFound(
      DeadLetterNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.DEAD_LETTER_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(ScheduleNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleScheduleNotFound(ScheduleNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.SCHEDULE_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(InvalidJobStateException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidJobState(InvalidJobStateException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.JOB_STATE_CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(DuplicateJobException.class)
  public ResponseEntity<ApiErrorResponse> handleDuplicateJob(DuplicateJobException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.DUPLICATE_JOB, ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException ex) {
    // enum/UUID の変換失敗は変換器の内部文言を出さずパラメータ名だけ返す。
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ApiErrorResponse> handleConstraintViolation(
      ConstraintViolationException ex) {
    final String message =
        ex.getConstraintViolations().stream()
            .map(ConstraintViolation::getMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request is invalid");
    return badRequest(message);
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, message);
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
