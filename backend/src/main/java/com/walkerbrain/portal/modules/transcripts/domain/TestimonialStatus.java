package com.walkerbrain.portal.modules.transcripts.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Stages of the testimonial pipeline. {@code DECLINED} and {@code PUBLISHED} are terminal.
 */
public enum TestimonialStatus {
    FLAGGED,
    CONTACTED,
    SCHEDULED,
    RECORDED,
    PUBLISHED,
    DECLINED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public Optional<TestimonialStatus> next() {
        return switch (this) {
            case FLAGGED -> Optional.of(CONTACTED);
            case CONTACTED -> Optional.of(SCHEDULED);
            case SCHEDULED -> Optional.of(RECORDED);
            case RECORDED -> Optional.of(PUBLISHED);
            case PUBLISHED, DECLINED -> Optional.empty();
        };
    }

    public static Optional<TestimonialStatus> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        for (TestimonialStatus status : values()) {
            if (status.value().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
