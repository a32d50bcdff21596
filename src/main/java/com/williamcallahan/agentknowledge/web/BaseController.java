package com.williamcallahan.agentknowledge.web;

import com.williamcallahan.agentknowledge.domain.errors.ApiErrorResponse;
import com.williamcallahan.agentknowledge.service.EmbeddingServiceUnavailableException;
import com.williamcallahan.agentknowledge.service.EntryEmbeddingException;
import com.williamcallahan.agentknowledge.service.HybridSearchException;
import com.williamcallahan.agentknowledge.store.KnowledgeStoreException;
import java.io.IOException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Base controller class providing common error handling patterns.
 *
 * <p>Maps domain failures to HTTP statuses: validation to 400, embedding provider failures to 502,
 * store failures to 503 (transient) or 500, search deadline expiry to 504.</p>
 */
public abstract class BaseController {
    private static final Logger log = LoggerFactory.getLogger(BaseController.class);

    protected final ExceptionResponseBuilder exceptionBuilder;

    /**
     * Creates a base controller wired to the shared exception response builder.
     */
    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleValidationException(IllegalArgumentException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidBody(MethodArgumentNotValidException invalidBody) {
        String fieldErrors = invalidBody.getBindingResult().getFieldErrors().stream()
                .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(ApiErrorResponse.error("Request validation failed", fieldErrors));
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ApiErrorResponse> handleInvalidParameters(HandlerMethodValidationException invalidParameters) {
        String parameterErrors = invalidParameters.getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(ApiErrorResponse.error("Request validation failed", parameterErrors));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiErrorResponse> handleBadParameter(Exception badParameter) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, badParameter.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException unreadableBody) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request body", unreadableBody);
    }

    @ExceptionHandler(EntryEmbeddingException.class)
    public ResponseEntity<ApiErrorResponse> handleEntryEmbeddingFailure(EntryEmbeddingException embeddingFailure) {
        log.error("[API] Entry {} stored without embeddings", embeddingFailure.getEntryId());
        return exceptionBuilder.buildEntryErrorResponse(
                HttpStatus.BAD_GATEWAY,
                "Entry stored but embedding failed",
                embeddingFailure,
                embeddingFailure.getEntryId());
    }

    @ExceptionHandler(EmbeddingServiceUnavailableException.class)
    public ResponseEntity<ApiErrorResponse> handleEmbeddingUnavailable(
            EmbeddingServiceUnavailableException embeddingFailure) {
        log.error("[API] Embedding provider failure: {}", embeddingFailure.getMessage());
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.BAD_GATEWAY, "Embedding provider unavailable", embeddingFailure);
    }

    @ExceptionHandler(KnowledgeStoreException.class)
    public ResponseEntity<ApiErrorResponse> handleStoreFailure(KnowledgeStoreException storeFailure) {
        HttpStatus status = storeFailure.isTransient() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.INTERNAL_SERVER_ERROR;
        log.error("[API] Knowledge store failure (transient={}): {}", storeFailure.isTransient(), storeFailure.getMessage());
        return exceptionBuilder.buildErrorResponse(status, "Knowledge store failure", storeFailure);
    }

    @ExceptionHandler(HybridSearchException.class)
    public ResponseEntity<ApiErrorResponse> handleSearchFailure(HybridSearchException searchFailure) {
        HttpStatus status = searchFailure.isTimedOut() ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.INTERNAL_SERVER_ERROR;
        log.error("[API] Search failed: {}", searchFailure.getMessage());
        return exceptionBuilder.buildErrorResponse(status, "Search failed", searchFailure);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ApiErrorResponse> handleIoFailure(IOException ioFailure) {
        log.error("[API] I/O failure: {}", ioFailure.getMessage(), ioFailure);
        return exceptionBuilder.buildErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "I/O failure", ioFailure);
    }
}
