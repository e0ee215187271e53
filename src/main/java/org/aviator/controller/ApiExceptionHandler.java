package org.aviator.controller;

import lombok.extern.slf4j.Slf4j;
import org.aviator.service.crash.CrashException;
import org.aviator.service.crash.RejectionReason;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.NoSuchElementException;

// Aucune trace de pile ne sort de l'API
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(CrashException.class)
    public ResponseEntity<?> crash(CrashException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getReason().name(), "message", e.getMessage()));
    }

    // montant -> INVALID_AMOUNT, multiplicateurs -> INVALID_MULTIPLIER
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<?> invalid(MethodArgumentNotValidException e) {
        FieldError f = e.getBindingResult().getFieldError();
        RejectionReason reason = f != null && "montant".equals(f.getField())
                ? RejectionReason.INVALID_AMOUNT
                : RejectionReason.INVALID_MULTIPLIER;
        String message = f == null || f.getDefaultMessage() == null ? "Requête invalide" : f.getDefaultMessage();
        return ResponseEntity.badRequest().body(Map.of("error", reason.name(), "message", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<?> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(Map.of("error", "INVALID_REQUEST", "message", "Corps de requête illisible"));
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<?> notFound(NoSuchElementException e) {
        return ResponseEntity.status(404).body(Map.of("error", "NOT_FOUND", "message", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<?> accessDenied(AccessDeniedException e) {
        return ResponseEntity.status(403).body(Map.of("error", "FORBIDDEN"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> unexpected(Exception e) {
        // exceptions MVC standard (401, 404, 405...) : on garde leur statut
        if (e instanceof ErrorResponse) {
            ErrorResponse er = (ErrorResponse) e;
            return ResponseEntity.status(er.getStatusCode()).body(Map.of("error", String.valueOf(er.getStatusCode().value())));
        }
        log.error("Erreur inattendue", e);
        return ResponseEntity.status(500).body(Map.of("error", "INTERNAL_ERROR"));
    }
}
