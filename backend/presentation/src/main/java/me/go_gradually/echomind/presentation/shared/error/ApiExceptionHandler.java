package me.go_gradually.echomind.presentation.shared.error;

import me.go_gradually.echomind.application.catalog.model.VoiceDownloadException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Error bodies carry both {@code message} and {@code detail}; the browser client reads {@code detail}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> badRequest(Exception e) {
        return body(e.getMessage(), "Bad request");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> invalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().isEmpty()
                ? null
                : e.getBindingResult().getFieldErrors().get(0).getDefaultMessage();
        return body(message, "Invalid request");
    }

    @ExceptionHandler(VoiceDownloadException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, String> downloadFailed(VoiceDownloadException e) {
        return body(e.getMessage(), "Voice download failed");
    }

    private Map<String, String> body(String message, String fallback) {
        String resolved = message == null || message.isBlank() ? fallback : message;
        return Map.of("message", resolved, "detail", resolved);
    }
}
