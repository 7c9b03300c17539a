package com.walkerbrain.portal.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.regex.Pattern;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Issues URL-safe session tokens and derives the digest under which they are stored.
 */
@Component
public class SessionTokenGenerator {

    private static final Pattern URL_SAFE = Pattern.compile("[A-Za-z0-9_-]+");
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private final SecureRandom secureRandom;
    private final int tokenBytes;
    private final int tokenLength;

    public SessionTokenGenerator(@Value("${app.session.token-bytes:32}") int tokenBytes) {
        this(new SecureRandom(), tokenBytes);
    }

    SessionTokenGenerator(SecureRandom secureRandom, int tokenBytes) {
        if (tokenBytes < 32) {
            throw new IllegalArgumentException("tokenBytes must be at least 32");
        }
        this.secureRandom = secureRandom;
        this.tokenBytes = tokenBytes;
        this.tokenLength = (tokenBytes * 8 + 5) / 6;
    }

    public String generate() {
        byte[] bytes = new byte[tokenBytes];
        secureRandom.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }

    /**
     * Cheap structural check run before any store lookup.
     */
    public boolean isWellFormed(String token) {
        return token != null && token.length() == tokenLength && URL_SAFE.matcher(token).matches();
    }

    public int tokenLength() {
        return tokenLength;
    }

    public String hash(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(token.getBytes(StandardCharsets.US_ASCII)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
