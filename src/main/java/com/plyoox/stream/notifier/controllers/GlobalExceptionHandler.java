package com.plyoox.stream.notifier.controllers;

import com.plyoox.stream.notifier.exceptions.NotifierException;
import com.plyoox.stream.notifier.model.ExceptionResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.NoHandlerFoundException;

import java.util.Map;

import static com.plyoox.stream.notifier.conf.CommonConfig.DEFAULT_OBJECT_MAPPER;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    static final String NOT_FOUND_MESSAGE = "Cannot find this path or this method.";
    static final String BAD_REQUEST_MESSAGE = "Invalid request.";

    @ExceptionHandler(NotifierException.class)
    public ResponseEntity<ExceptionResponse> handleNotifierException(NotifierException e, WebRequest request) {
        HttpStatus status = toStatus(e.getKind());
        if (status.is5xxServerError()) {
            log.error("controller exception for request: {}, params: {}", request.getDescription(false), serialize(request.getParameterMap()), e);
        } else {
            log.warn("rejected request: {}, kind: {}, reason: {}", request.getDescription(false), e.getKind(), e.getMessage());
        }
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(new ExceptionResponse(status.value(), toMessage(e), null, e.getKind().name()));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MissingRequestHeaderException.class,
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ExceptionResponse handleBadRequest(Exception e, WebRequest request) {
        log.warn("bad request: {}, reason: {}", request.getDescription(false), e.getMessage());
        return new ExceptionResponse(HttpStatus.BAD_REQUEST.value(), BAD_REQUEST_MESSAGE, null, NotifierException.Kind.VALIDATION.name());
    }

    @ExceptionHandler({NoHandlerFoundException.class, HttpRequestMethodNotSupportedException.class})
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ExceptionResponse handleNotFound(Exception e, WebRequest request) {
        log.debug("no route for request: {}", request.getDescription(false));
        return new ExceptionResponse(HttpStatus.NOT_FOUND.value(), NOT_FOUND_MESSAGE, null, null);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ExceptionResponse handleServerException(Exception e, WebRequest request) {
        String description = request.getDescription(false);
        Map<String, String[]> parameterMap = request.getParameterMap();
        log.error("controller exception for request: {}, params: {}", description, serialize(parameterMap), e);
        return new ExceptionResponse(HttpStatus.INTERNAL_SERVER_ERROR.value(), "Internal error.", null, NotifierException.Kind.INTERNAL.name());
    }

    static HttpStatus toStatus(NotifierException.Kind kind) {
        switch (kind) {
            case VALIDATION:
                return HttpStatus.BAD_REQUEST;
            case CONFLICT:
                return HttpStatus.CONFLICT;
            case AUTH:
            case REMOTE_API:
                return HttpStatus.BAD_GATEWAY;
            case TRANSPORT:
                return HttpStatus.GATEWAY_TIMEOUT;
            case CONCURRENCY:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    // upstream and database details stay in the log
    private static String toMessage(NotifierException e) {
        switch (e.getKind()) {
            case VALIDATION:
            case CONFLICT:
                return e.getMessage();
            case AUTH:
                return "Twitch rejected the authorization.";
            case REMOTE_API:
            case TRANSPORT:
                return "Twitch request failed.";
            case CONCURRENCY:
                return "Service is busy, try again later.";
            default:
                return "Internal error.";
        }
    }

    private String serialize(Object object) {
        try {
            return DEFAULT_OBJECT_MAPPER.writeValueAsString(object);
        } catch (Exception e) {
            return null;
        }
    }
}
