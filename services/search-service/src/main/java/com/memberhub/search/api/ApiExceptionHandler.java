package com.memberhub.search.api;

import com.memberhub.search.api.dto.ErrorResponse;
import com.memberhub.search.filter.InvalidFilterException;
import com.memberhub.search.index.DimensionMismatchException;
import com.memberhub.search.index.InvalidContentException;
import com.memberhub.search.service.EmbeddingNotFoundException;
import com.memberhub.search.service.InvalidSearchRequestException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(DimensionMismatchException.class)
    public ResponseEntity<ErrorResponse> handleDimensionMismatch(DimensionMismatchException ex, HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, "dimension_mismatch", ex.getMessage(), request);
    }

    @ExceptionHandler(InvalidFilterException.class)
    public ResponseEntity<ErrorResponse> handleInvalidFilter(InvalidFilterException ex, HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, "invalid_filter", ex.getMessage(), request);
    }

    @ExceptionHandler({InvalidSearchRequestException.class, InvalidContentException.class})
    public ResponseEntity<ErrorResponse> handleInvalidRequest(RuntimeException ex, HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), request);
    }

    @ExceptionHandler(EmbeddingNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleEmbeddingNotFound(EmbeddingNotFoundException ex, HttpServletRequest request) {
        return error(HttpStatus.NOT_FOUND, "embedding_not_found", ex.getMessage(), request);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        HttpMediaTypeNotSupportedException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", "Invalid request", request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("request_failed path={} message={}", request.getRequestURI(), ex.getMessage(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "Unexpected error", request);
    }

    private ResponseEntity<ErrorResponse> error(HttpStatus status, String code, String message, HttpServletRequest request) {
        String traceId = RequestIdUtil.resolveOrGenerate(request, "x-trace-id");
        String requestId = RequestIdUtil.resolveOrGenerate(request, "x-request-id");
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, traceId, requestId));
    }
}
