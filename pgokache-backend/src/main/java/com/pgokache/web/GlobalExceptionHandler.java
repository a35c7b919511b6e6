package com.pgokache.web;

import com.pgokache.api.ErrorResponse;
import com.pgokache.error.ErrorKind;
import com.pgokache.error.PgOkacheException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.stream.Collectors;

/**
 * Renders every failure as {@code {code, detail, trace_id}} with the status of its {@link ErrorKind}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(PgOkacheException.class)
    public ResponseEntity<ErrorResponse> handlePgOkacheException(PgOkacheException ex) {
        if (ex.getKind() == ErrorKind.INTERNAL_ERROR) {
            log.error("Request failed: kind={}", ex.getKind(), ex);
        } else {
            log.info("Request failed: kind={}, detail={}", ex.getKind(), ex.getMessage());
        }
        return respond(ex.getKind(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond(ErrorKind.VALIDATION_ERROR, "Input validation failed: " + details);
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(Exception ex) {
        return respond(ErrorKind.VALIDATION_ERROR, ex.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        String detail = cause instanceof IllegalArgumentException
                ? cause.getMessage()
                : "Request body is missing or malformed";
        return respond(ErrorKind.VALIDATION_ERROR, detail);
    }

    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFoundException(Exception ex) {
        return respond(ErrorKind.NOT_FOUND, "Not found");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleAllExceptions(Exception ex) {
        log.error("Unhandled exception occurred", ex);
        return respond(ErrorKind.INTERNAL_ERROR, "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorKind kind, String detail) {
        ErrorResponse error = ErrorResponse.builder()
                .code(kind.name())
                .detail(detail)
                .traceId(MDC.get(TraceIdFilter.MDC_TRACE_ID))
                .build();
        return ResponseEntity.status(kind.getHttpStatus()).body(error);
    }
}
