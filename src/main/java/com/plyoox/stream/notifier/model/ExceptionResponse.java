package com.plyoox.stream.notifier.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

import java.time.Instant;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExceptionResponse {
    Instant timestamp = Instant.now();
    int code;
    String message;
    Object details;
    String errorKind;
}
