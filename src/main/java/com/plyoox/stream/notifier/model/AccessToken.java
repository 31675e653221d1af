package com.plyoox.stream.notifier.model;

import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class AccessToken {
    @NonNull
    @ToString.Exclude
    String value;
    long expiresAtUnix;

    public boolean isUsableAt(long nowUnix, long skewSeconds) {
        return !value.isEmpty() && expiresAtUnix - skewSeconds > nowUnix;
    }
}
