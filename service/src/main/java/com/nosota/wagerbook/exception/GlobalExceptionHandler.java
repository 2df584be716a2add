package com.nosota.wagerbook.exception;

import com.nosota.wagerbook.dto.ErrorResponse;
import com.nosota.wagerbook.error.AlreadySettledException;
import com.nosota.wagerbook.error.BettingClosedException;
import com.nosota.wagerbook.error.InsufficientBalanceException;
import com.nosota.wagerbook.error.InvalidOddsException;
import com.nosota.wagerbook.error.InvalidOutcomeException;
import com.nosota.wagerbook.error.NotFoundException;
import com.nosota.wagerbook.error.TransactionConflictException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Not found [correlationId={}, code={}]: {}", correlationId, ex.getCode(), ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.NOT_FOUND.value(),
                "Not Found",
                ex.getCode(),
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error);
    }

    @ExceptionHandler(BettingClosedException.class)
    public ResponseEntity<ErrorResponse> handleBettingClosed(BettingClosedException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Betting closed [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Betting Closed",
                "BETTING_CLOSED",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(InsufficientBalanceException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientBalance(
            InsufficientBalanceException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Insufficient balance [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Insufficient Balance",
                "INSUFFICIENT_BALANCE",
                ex.getMessage(),
                request.getRequestURI(),
                Map.of("balance", ex.getBalance(), "required", ex.getRequired())
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(AlreadySettledException.class)
    public ResponseEntity<ErrorResponse> handleAlreadySettled(AlreadySettledException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Wager already settled [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Already Settled",
                "WAGER_ALREADY_SETTLED",
                ex.getMessage(),
                request.getRequestURI(),
                Map.of("existingStatus", ex.getExistingStatus())
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(InvalidOutcomeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidOutcome(InvalidOutcomeException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Invalid outcome [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Invalid Outcome",
                "INVALID_OUTCOME",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(InvalidOddsException.class)
    public ResponseEntity<ErrorResponse> handleInvalidOdds(InvalidOddsException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Invalid odds [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Invalid Odds",
                "INVALID_ODDS",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(TransactionConflictException.class)
    public ResponseEntity<ErrorResponse> handleTransactionConflict(
            TransactionConflictException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Transaction conflict [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.retryable(
                HttpStatus.CONFLICT.value(),
                "Transaction Conflict",
                "TRANSACTION_CONFLICT",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        return invalidRequest(message, request);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {
        String message = ex.getConstraintViolations().stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .collect(Collectors.joining("; "));
        return invalidRequest(message, request);
    }

    @ExceptionHandler({
            HandlerMethodValidationException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex, HttpServletRequest request) {
        return invalidRequest(ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Illegal argument [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Invalid Argument",
                "INVALID_ARGUMENT",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(
            IllegalStateException ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Illegal state [correlationId={}]: {}", correlationId, ex.getMessage());

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.CONFLICT.value(),
                "Invalid State",
                "INVALID_STATE",
                ex.getMessage(),
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.CONFLICT).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.error("Unexpected error [correlationId={}]", correlationId, ex);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                "INTERNAL_ERROR",
                "An unexpected error occurred. Please contact support with correlation ID: " + correlationId,
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ResponseEntity<ErrorResponse> invalidRequest(String message, HttpServletRequest request) {
        String correlationId = MDC.get("correlationId");
        log.warn("Invalid request [correlationId={}]: {}", correlationId, message);

        ErrorResponse error = ErrorResponse.of(
                HttpStatus.BAD_REQUEST.value(),
                "Invalid Request",
                "INVALID_REQUEST",
                message,
                request.getRequestURI()
        );
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }
}
