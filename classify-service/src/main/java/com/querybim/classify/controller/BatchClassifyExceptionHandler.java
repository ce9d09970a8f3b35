package com.querybim.classify.controller;

import com.querybim.classify.model.BatchClassifyResponse;
import com.querybim.classify.service.BatchClassifyService;
import com.querybim.classify.service.InvalidBatchRequestException;
import com.querybim.classify.service.MatchBackendException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class BatchClassifyExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(BatchClassifyExceptionHandler.class);

    @ExceptionHandler(InvalidBatchRequestException.class)
    public ResponseEntity<BatchClassifyResponse> invalidBatch(InvalidBatchRequestException ex) {
        return ResponseEntity.badRequest()
                .body(BatchClassifyResponse.failure(ex.getError(), ex.getDetails()));
    }

    // Body is not JSON, or "queries" is not an array of objects.
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<BatchClassifyResponse> unreadableBody(HttpMessageNotReadableException ex) {
        log.debug("unreadable batch classify body: {}", ex.getMessage());
        return ResponseEntity.badRequest()
                .body(BatchClassifyResponse.failure(BatchClassifyService.INVALID_QUERIES, null));
    }

    @ExceptionHandler(MatchBackendException.class)
    public ResponseEntity<BatchClassifyResponse> backendFailure(MatchBackendException ex) {
        log.error("similarity backend call failed: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(BatchClassifyResponse.failure("Database processing failed", ex.getMessage()));
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<BatchClassifyResponse> methodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
                .body(BatchClassifyResponse.failure("Method not allowed", null));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<BatchClassifyResponse> unsupportedMediaType(HttpMediaTypeNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(BatchClassifyResponse.failure("Unsupported media type", String.valueOf(ex.getContentType())));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<BatchClassifyResponse> notFound(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(BatchClassifyResponse.failure("Not found", null));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<BatchClassifyResponse> unexpected(Exception ex) {
        log.error("batch classify handler error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(BatchClassifyResponse.failure("Internal server error", null));
    }
}
