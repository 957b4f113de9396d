package com.aurumshield.backend.policy;

public record TriComponent(double weight, int raw, double weighted) {

    public static TriComponent of(double weight, int raw) {
        return new TriComponent(weight, raw, raw * weight);
    }
}
