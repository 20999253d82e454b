package io.modelgate.core.backend;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum Tier {
    FAST(0, 20),
    LOW(20, 40),
    MEDIUM(40, 60),
    HIGH(60, 80),
    ULTRA(80, 101);

    private final int minScore;
    private final int maxScoreExclusive;

    Tier(int minScore, int maxScoreExclusive) {
        this.minScore = minScore;
        this.maxScoreExclusive = maxScoreExclusive;
    }

    public int rank() {
        return ordinal() + 1;
    }

    /**
     * Buckets a complexity score. Anything at or above 100, and anything that misses every
     * bucket, lands in {@link #ULTRA}.
     */
    public static Tier fromScore(int score) {
        for (Tier tier : values()) {
            if (score >= tier.minScore && score < tier.maxScoreExclusive) {
                return tier;
            }
        }
        return ULTRA;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static Tier fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        return Tier.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
