package com.aurumshield.backend.capital;

public enum OverrideScopeType {
    GLOBAL,
    ACTION
}
