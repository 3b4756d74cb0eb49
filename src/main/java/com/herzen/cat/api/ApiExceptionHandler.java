package com.herzen.cat.api;

import com.herzen.cat.exception.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.LocalDateTime;
import java.util.List;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public record ErrorResponse(LocalDateTime timestamp, int status, String error, List<String> details) {}

    @ExceptionHandler(SessionNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse handleNotFound(SessionNotFoundException exception) {
        return error(HttpStatus.NOT_FOUND, "Not found", exception);
    }

    @ExceptionHandler({InvalidSessionStateException.class, UnknownOrDuplicateItemException.class})
    @ResponseStatus(HttpStatus.CONFLICT)
    public ErrorResponse handleConflict(RuntimeException exception) {
        return error(HttpStatus.CONFLICT, "Conflict", exception);
    }

    @ExceptionHandler(ItemPoolEmptyException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public ErrorResponse handlePoolEmpty(ItemPoolEmptyException exception) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "Item pool empty", exception);
    }

    @ExceptionHandler(SnapshotIncompatibleException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public ErrorResponse handleSnapshot(SnapshotIncompatibleException exception) {
        log.error("Stored session cannot be restored", exception);
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "Session snapshot incompatible", exception);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleBadRequest(IllegalArgumentException exception) {
        return error(HttpStatus.BAD_REQUEST, "Bad request", exception);
    }

    private ErrorResponse error(HttpStatus status, String error, RuntimeException exception) {
        return new ErrorResponse(LocalDateTime.now(), status.value(), error, List.of(String.valueOf(exception.getMessage())));
    }
}
