package com.plyoox.stream.notifier.utils;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Authenticity check for EventSub webhook deliveries.
 * <p>
 * The expected signature is {@code sha256=} followed by the lowercase hex HMAC-SHA256 of
 * {@code messageId + timestamp + rawBody}, keyed by the subscription secret. The body must be the
 * untouched request bytes, a re-serialized body will not match.
 */
@Slf4j
public final class EventSubSignatures {
    public static final String SIGNATURE_PREFIX = "sha256=";
    public static final int MIN_SECRET_LENGTH = 10;
    public static final int MAX_SECRET_LENGTH = 100;

    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    private EventSubSignatures() {
    }

    /**
     * Twitch accepts subscription secrets of 10 to 100 ASCII characters.
     *
     * @throws IllegalArgumentException if {@code secret} cannot be used for subscriptions
     */
    @Nonnull
    public static String requireValidSecret(@Nullable String secret) {
        if (StringUtils.isBlank(secret)) {
            throw new IllegalArgumentException("twitch.eventsub.secret is not set");
        }
        if (secret.length() < MIN_SECRET_LENGTH || secret.length() > MAX_SECRET_LENGTH || !StringUtils.isAsciiPrintable(secret)) {
            throw new IllegalArgumentException("twitch.eventsub.secret must be " + MIN_SECRET_LENGTH + " to "
                    + MAX_SECRET_LENGTH + " printable ASCII characters, got length " + secret.length());
        }
        return secret;
    }

    public static boolean verify(@Nullable String messageId,
                                 @Nullable String timestamp,
                                 @Nonnull byte[] rawBody,
                                 @Nullable String signatureHeader,
                                 @Nonnull String secret) {
        if (messageId == null || timestamp == null || signatureHeader == null) {
            return false;
        }
        if (signatureHeader.length() < SIGNATURE_PREFIX.length()
                || !signatureHeader.regionMatches(true, 0, SIGNATURE_PREFIX, 0, SIGNATURE_PREFIX.length())) {
            log.warn("verify(): signature header has no {} prefix, length {}", SIGNATURE_PREFIX, signatureHeader.length());
            return false;
        }

        byte[] expected;
        try {
            expected = HEX.decode(signatureHeader.substring(SIGNATURE_PREFIX.length()).toLowerCase());
        } catch (IllegalArgumentException e) {
            log.warn("verify(): signature is not valid hex: {}", e.getMessage());
            return false;
        }

        return MessageDigest.isEqual(sign(messageId, timestamp, rawBody, secret), expected);
    }

    @Nonnull
    public static byte[] sign(@Nonnull String messageId,
                              @Nonnull String timestamp,
                              @Nonnull byte[] rawBody,
                              @Nonnull String secret) {
        Hasher hasher = Hashing.hmacSha256(secret.getBytes(StandardCharsets.UTF_8)).newHasher();
        hasher.putBytes(messageId.getBytes(StandardCharsets.UTF_8));
        hasher.putBytes(timestamp.getBytes(StandardCharsets.UTF_8));
        hasher.putBytes(rawBody);
        return hasher.hash().asBytes();
    }

    @Nonnull
    public static String signatureHeader(@Nonnull String messageId,
                                         @Nonnull String timestamp,
                                         @Nonnull byte[] rawBody,
                                         @Nonnull String secret) {
        return SIGNATURE_PREFIX + HEX.encode(sign(messageId, timestamp, rawBody, secret));
    }
}
