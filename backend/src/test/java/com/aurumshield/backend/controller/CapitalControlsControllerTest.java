package com.aurumshield.backend.controller;

import com.aurumshield.backend.capital.CapitalFixtures;
import com.aurumshield.backend.capital.ControlAction;
import com.aurumshield.backend.capital.OverrideScopeType;
import com.aurumshield.backend.dto.CreateOverrideRequest;
import com.aurumshield.backend.repository.CapitalOverrideRepository;
import com.aurumshield.backend.service.ExposureStateProvider;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class CapitalControlsControllerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ExposureStateProvider exposureStateProvider;

    @Autowired
    private CapitalOverrideRepository overrideRepository;

    @BeforeEach
    void resetState() {
        overrideRepository.deleteAll();
        exposureStateProvider.replace(CapitalFixtures.stateWithOpenSettlement(BigDecimal.ZERO));
    }

    @Test
    void exposureNearHardstopFreezesMarketplace() throws Exception {
        pushExposure("49000000");

        mockMvc.perform(get("/api/capital-controls"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"))
                .andExpect(jsonPath("$.mode").value("FREEZE_MARKETPLACE"))
                .andExpect(jsonPath("$.available").value(true))
                .andExpect(jsonPath("$.blocks.PUBLISH_LISTING").value(true))
                .andExpect(jsonPath("$.blocks.OPEN_SETTLEMENT").value(false));
    }

    @Test
    void blockedActionReturnsLocked() throws Exception {
        pushExposure("49000000");

        mockMvc.perform(post("/api/capital-controls/check/PUBLISH_LISTING")
                        .param("actorRole", "trader")
                        .param("actorUserId", "u-9"))
                .andExpect(status().isLocked())
                .andExpect(jsonPath("$.errorCode").value("CAPITAL_CONTROL_BLOCKED"))
                .andExpect(jsonPath("$.details[0].field").value("PUBLISH_LISTING"));

        mockMvc.perform(post("/api/capital-controls/check/OPEN_SETTLEMENT"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allowed").value(true));
    }

    @Test
    void actionOverrideLetsBlockedActionThrough() throws Exception {
        pushExposure("49000000");
        CreateOverrideRequest request = overrideRequest(OverrideScopeType.ACTION, "treasury");
        request.setActionKey(ControlAction.PUBLISH_LISTING);

        mockMvc.perform(post("/api/capital-controls/overrides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id", startsWith("OVR-u-42-")))
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.modeAtCreation").value("FREEZE_MARKETPLACE"));

        mockMvc.perform(post("/api/capital-controls/check/PUBLISH_LISTING"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.overrideId", startsWith("OVR-u-42-")));
    }

    @Test
    void globalOverrideRejectedWhenMarketplaceFrozen() throws Exception {
        pushExposure("49000000");

        mockMvc.perform(post("/api/capital-controls/overrides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(overrideRequest(OverrideScopeType.GLOBAL, "treasury"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].issue", startsWith("GLOBAL override not permitted")));
    }

    @Test
    void unauthorizedRoleIsForbidden() throws Exception {
        CreateOverrideRequest request = overrideRequest(OverrideScopeType.ACTION, "trader");
        request.setActionKey(ControlAction.CREATE_RESERVATION);

        mockMvc.perform(post("/api/capital-controls/overrides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isForbidden());
    }

    @Test
    void oversizedActorIdIsValidationError() throws Exception {
        CreateOverrideRequest request = overrideRequest(OverrideScopeType.ACTION, "treasury");
        request.setActionKey(ControlAction.CREATE_RESERVATION);
        request.setActorUserId("u".repeat(70));

        mockMvc.perform(post("/api/capital-controls/overrides")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details[0].field").value("actorUserId"));
    }

    @Test
    void revokingUnknownOverrideIsNotFound() throws Exception {
        mockMvc.perform(post("/api/capital-controls/overrides/OVR-missing/revoke")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actorRole\":\"admin\",\"actorUserId\":\"u-1\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void unknownActionIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/capital-controls/check/TELEPORT_GOLD"))
                .andExpect(status().isBadRequest());
    }

    private void pushExposure(String notional) throws Exception {
        mockMvc.perform(put("/api/capital/exposure")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(
                                CapitalFixtures.stateWithOpenSettlement(new BigDecimal(notional)))))
                .andExpect(status().isOk());
    }

    private static CreateOverrideRequest overrideRequest(OverrideScopeType scope, String role) {
        return CreateOverrideRequest.builder()
                .scope(scope)
                .reason("Clearing settlement backlog before month end")
                .expiresAt(Instant.now().plus(Duration.ofHours(2)))
                .actorRole(role)
                .actorUserId("u-42")
                .build();
    }
}
