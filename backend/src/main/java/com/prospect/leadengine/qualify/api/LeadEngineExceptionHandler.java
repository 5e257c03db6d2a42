package com.prospect.leadengine.qualify.api;

import com.prospect.leadengine.qualify.model.InvalidLeadException;
import com.prospect.leadengine.qualify.playlist.PlaylistNotFoundException;
import com.prospect.leadengine.qualify.playlist.PlaylistPersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class LeadEngineExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(LeadEngineExceptionHandler.class);

    @ExceptionHandler(PlaylistNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(PlaylistNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(Map.of("error", "playlist_not_found", "message", ex.getMessage()));
    }

    @ExceptionHandler(PlaylistPersistenceException.class)
    public ResponseEntity<Map<String, String>> handlePersistence(PlaylistPersistenceException ex) {
        HttpStatus status = ex.getCause() instanceof DataIntegrityViolationException
            ? HttpStatus.CONFLICT
            : HttpStatus.INTERNAL_SERVER_ERROR;
        log.warn("Playlist persistence failure: {}", ex.getMessage(), ex.getCause());
        return ResponseEntity.status(status)
            .body(Map.of("error", "playlist_persistence", "message", ex.getMessage()));
    }

    @ExceptionHandler(InvalidLeadException.class)
    public ResponseEntity<Map<String, String>> handleInvalidLead(InvalidLeadException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "invalid_lead", "message", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        String message = ex.getMessage() == null ? "bad request" : ex.getMessage();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
            .body(Map.of("error", "bad_request", "message", message));
    }
}
