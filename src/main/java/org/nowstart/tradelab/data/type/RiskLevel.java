package org.nowstart.tradelab.data.type;

public enum RiskLevel {
    SAFE,
    LOW,
    MEDIUM,
    HIGH;

    public static RiskLevel fromScore(int score) {
        if (score >= 5) {
            return HIGH;
        }
        if (score >= 3) {
            return MEDIUM;
        }
        if (score >= 1) {
            return LOW;
        }
        return SAFE;
    }
}
