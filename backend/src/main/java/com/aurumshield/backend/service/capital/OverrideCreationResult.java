package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.CapitalOverride;

/**
 * @param isNew false when the same actor already created this override in the same minute
 */
public record OverrideCreationResult(CapitalOverride override, boolean isNew) {}
