package it.aw.annotator.controller;

import it.aw.annotator.controller.dto.ErrorResponse;
import it.aw.annotator.exception.DocumentNotAnalyzableException;
import it.aw.annotator.exception.IngestionRejectedException;
import it.aw.annotator.exception.NotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Traduce le eccezioni applicative in risposte {@code {"message": ...}}.
 * <ul>
 *   <li>400: input non utilizzabile o parametri non validi</li>
 *   <li>404: entità richiesta inesistente</li>
 *   <li>500: tutto il resto, inclusi gli errori di embedding e LLM</li>
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({IngestionRejectedException.class, DocumentNotAnalyzableException.class})
    public ResponseEntity<ErrorResponse> handleRejected(RuntimeException ex, HttpServletRequest req) {
        log.info("[REJECTED] {} - {}", req.getRequestURI(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException ex, HttpServletRequest req) {
        log.debug("[NOT-FOUND] {} - {}", req.getRequestURI(), ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex, HttpServletRequest req) {
        log.debug("[BAD-REQUEST] {} - {}", req.getRequestURI(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleMalformed(Exception ex, HttpServletRequest req) {
        log.debug("[MALFORMED] {} - {}", req.getRequestURI(), ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "Richiesta non valida");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex, HttpServletRequest req) {
        log.error("Errore durante {} {}", req.getMethod(), req.getRequestURI(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR,
                ex.getMessage() != null ? ex.getMessage() : "Errore interno");
    }

    private static ResponseEntity<ErrorResponse> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(message));
    }
}
