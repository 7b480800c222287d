package io.predterm.service.analytics;

public enum SentimentLabel {
    EXTREMELY_BULLISH("Extremely Bullish"),
    BULLISH("Bullish"),
    SLIGHTLY_BULLISH("Slightly Bullish"),
    NEUTRAL("Neutral"),
    SLIGHTLY_BEARISH("Slightly Bearish"),
    BEARISH("Bearish"),
    EXTREMELY_BEARISH("Extremely Bearish");

    private final String displayName;

    SentimentLabel(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static SentimentLabel forScore(double score) {
        if (score >= 60) return EXTREMELY_BULLISH;
        if (score >= 30) return BULLISH;
        if (score >= 10) return SLIGHTLY_BULLISH;
        if (score <= -60) return EXTREMELY_BEARISH;
        if (score <= -30) return BEARISH;
        if (score <= -10) return SLIGHTLY_BEARISH;
        return NEUTRAL;
    }
}
