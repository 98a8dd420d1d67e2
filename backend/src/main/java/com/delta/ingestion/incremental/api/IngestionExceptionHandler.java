package com.delta.ingestion.incremental.api;

import com.delta.ingestion.incremental.model.ErrorResponse;
import com.delta.ingestion.incremental.service.ConcurrentTransitionException;
import com.delta.ingestion.incremental.service.ProviderNotFoundException;
import com.delta.ingestion.incremental.service.PublishUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.HandlerMapping;

import java.util.Map;

@RestControllerAdvice
public class IngestionExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(IngestionExceptionHandler.class);

    @ExceptionHandler(ProviderNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleProviderNotFound(ProviderNotFoundException ex, HttpServletRequest request) {
        if ("GET".equalsIgnoreCase(request.getMethod())) {
            log.error("{} - No ingestion record found in the database!", ex.getProvider());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.missingStatus(ex.getMessage()));
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(PublishUnavailableException.class)
    public ResponseEntity<ErrorResponse> handlePublishUnavailable(PublishUnavailableException ex) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(ErrorResponse.forProvider(ex.getProvider(), ex.getMessage()));
    }

    @ExceptionHandler(ConcurrentTransitionException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentTransition(ConcurrentTransitionException ex) {
        log.warn("Ingestion transition conflict: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorResponse> handleDataAccess(DataAccessException ex, HttpServletRequest request) {
        String target = request.getMethod() + " " + request.getRequestURI();
        log.error("Ingestion store failure on {}", target, ex);
        String message = "Ingestion store unavailable during " + target + ": " + ex.getMostSpecificCause().getMessage();
        String provider = providerOf(request);
        ErrorResponse body = provider == null ? ErrorResponse.of(message) : ErrorResponse.forProvider(provider, message);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    private static String providerOf(HttpServletRequest request) {
        Object variables = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (variables instanceof Map<?, ?> map) {
            Object provider = map.get("provider");
            return provider == null ? null : provider.toString();
        }
        return null;
    }
}
