package com.aurumshield.backend.policy;

public enum TriBand {
    GREEN,
    AMBER,
    RED;

    public static TriBand forScore(int score) {
        if (score <= 3) {
            return GREEN;
        }
        return score <= 6 ? AMBER : RED;
    }
}
