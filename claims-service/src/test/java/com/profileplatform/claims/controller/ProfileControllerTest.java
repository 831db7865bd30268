package com.profileplatform.claims.controller;

import com.profileplatform.claims.dto.AbstentionDTO;
import com.profileplatform.claims.dto.ClaimDTO;
import com.profileplatform.claims.dto.ConfigSummaryDTO;
import com.profileplatform.claims.dto.InferenceRunSummary;
import com.profileplatform.claims.service.ProfileInferenceService;
import com.profileplatform.common.inference.InferenceEngine;
import com.profileplatform.common.config.InferenceConfig;
import com.profileplatform.common.model.UserInferenceInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.when;

class ProfileControllerTest {

    private ProfileInferenceService service;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        service = Mockito.mock(ProfileInferenceService.class);
        client = WebTestClient.bindToController(new ProfileController(service))
            .controllerAdvice(new ProfileExceptionHandler())
            .build();
    }

    @Test
    @DisplayName("POST /score returns the scored result")
    void score() {
        when(service.score(any(UserInferenceInput.class))).thenAnswer(inv ->
            InferenceEngine.defaults().scoreUser(inv.getArgument(0), InferenceConfig.defaults()));

        client.post().uri("/api/v1/profiles/score")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"userId\": 4, \"bio\": \"Founder & CEO at Acme Labs\", \"memberGroupKinds\": [\"bd\"]}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.userId").isEqualTo(4)
            .jsonPath("$.roleClaim.label").isEqualTo("founder_exec")
            .jsonPath("$.affiliations[0].name").isEqualTo("Acme Labs")
            .jsonPath("$.affiliations[0].source").isEqualTo("bio");
    }

    @Test
    @DisplayName("POST /infer/batch returns the run summary")
    void batch() {
        when(service.scoreAll(anyList())).thenReturn(Mono.just(
            new InferenceRunSummary("v0.5.1", 2, 0, 3, 1, List.of(), 12L)));

        client.post().uri("/api/v1/profiles/infer/batch")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("[{\"userId\": 1}, {\"userId\": 2}]")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.usersProcessed").isEqualTo(2)
            .jsonPath("$.claimsWritten").isEqualTo(3);
    }

    @Test
    @DisplayName("GET /{userId}/claims passes the model version filter through")
    void claims() {
        ClaimDTO claim = new ClaimDTO(11L, 4L, "has_role", "founder_exec", "supported", 0.7152,
            "v0.5.1", null, List.of(new ClaimDTO.EvidenceDTO("bio", "bio:founder_title", 3.0)));
        when(service.getClaims(eq(4L), eq("v0.5.1"))).thenReturn(Flux.just(claim));

        client.get().uri("/api/v1/profiles/4/claims?modelVersion=v0.5.1")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].objectValue").isEqualTo("founder_exec")
            .jsonPath("$[0].evidence[0].evidenceRef").isEqualTo("bio:founder_title");
    }

    @Test
    @DisplayName("GET /{userId}/abstentions without a version queries every version")
    void abstentions() {
        AbstentionDTO row = new AbstentionDTO(5L, "has_role", "insufficient_evidence",
            "role:community GATED", "v0.5.1", null);
        when(service.getAbstentions(eq(5L), isNull())).thenReturn(Flux.just(row));

        client.get().uri("/api/v1/profiles/5/abstentions")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].reasonCode").isEqualTo("insufficient_evidence")
            .jsonPath("$[0].predicate").isEqualTo("has_role");
    }

    @Test
    @DisplayName("GET /config reports the active version")
    void config() {
        when(service.getConfigSummary()).thenReturn(
            new ConfigSummaryDTO("v0.5.1", "", "v0.5.1", 1, 0.15, 0.3));

        client.get().uri("/api/v1/profiles/config")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.version").isEqualTo("v0.5.1")
            .jsonPath("$.minClaimConfidence").isEqualTo(0.15);
    }

    @Test
    @DisplayName("IllegalArgumentException → 400 with error body")
    void badRequest() {
        when(service.score(any(UserInferenceInput.class)))
            .thenThrow(new IllegalArgumentException("bad input"));

        client.post().uri("/api/v1/profiles/score")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"userId\": 4}")
            .exchange()
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("invalid_request")
            .jsonPath("$.details").isEqualTo("bad input");
    }
}
