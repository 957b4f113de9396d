package com.aurumshield.backend.service.capital;

import com.aurumshield.backend.capital.BreachEvent;
import com.aurumshield.backend.capital.CapitalSnapshot;
import com.aurumshield.backend.capital.ExposureDriver;

import java.time.Instant;
import java.util.List;

public record IntradayPacket(
        int packetVersion,
        Instant generatedAt,
        CapitalSnapshot intradaySnapshot,
        List<BreachEvent> breachEvents,
        List<ExposureDriver> topDrivers,
        List<String> auditEventIds
) {

    public static final int VERSION = 1;
}
