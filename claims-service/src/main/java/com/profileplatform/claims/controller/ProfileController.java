package com.profileplatform.claims.controller;

import com.profileplatform.claims.dto.AbstentionDTO;
import com.profileplatform.claims.dto.ClaimDTO;
import com.profileplatform.claims.dto.ConfigSummaryDTO;
import com.profileplatform.claims.dto.InferenceOutcomeDTO;
import com.profileplatform.claims.dto.InferenceRunSummary;
import com.profileplatform.claims.service.ProfileInferenceService;
import com.profileplatform.common.model.UserInferenceInput;
import com.profileplatform.common.model.UserInferenceResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/profiles")
public class ProfileController {

    private static final Logger log = LoggerFactory.getLogger(ProfileController.class);

    private final ProfileInferenceService inferenceService;

    public ProfileController(ProfileInferenceService inferenceService) {
        this.inferenceService = inferenceService;
    }

    /** Dry run: scores one user, writes nothing. */
    @PostMapping("/score")
    public Mono<ResponseEntity<UserInferenceResult>> score(@RequestBody UserInferenceInput input) {
        log.info("Score request received. userId={}", input.userId());
        return Mono.fromCallable(() -> inferenceService.score(input))
            .map(ResponseEntity::ok);
    }

    @PostMapping("/infer")
    public Mono<ResponseEntity<InferenceOutcomeDTO>> infer(@RequestBody UserInferenceInput input) {
        log.info("Infer request received. userId={}", input.userId());
        return inferenceService.infer(input)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Infer endpoint error. userId={}", input.userId(), e));
    }

    @PostMapping("/infer/batch")
    public Mono<ResponseEntity<InferenceRunSummary>> inferBatch(@RequestBody List<UserInferenceInput> inputs) {
        log.info("Batch infer request received. users={}", inputs.size());
        return inferenceService.scoreAll(inputs)
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Batch infer endpoint error. users={}", inputs.size(), e));
    }

    @GetMapping("/{userId}/claims")
    public Flux<ClaimDTO> claims(@PathVariable long userId,
                                 @RequestParam(required = false) String modelVersion) {
        log.info("Claims query received. userId={} modelVersion={}", userId, modelVersion);
        return inferenceService.getClaims(userId, modelVersion);
    }

    @GetMapping("/{userId}/abstentions")
    public Flux<AbstentionDTO> abstentions(@PathVariable long userId,
                                           @RequestParam(required = false) String modelVersion) {
        log.info("Abstentions query received. userId={} modelVersion={}", userId, modelVersion);
        return inferenceService.getAbstentions(userId, modelVersion);
    }

    @GetMapping("/config")
    public Mono<ResponseEntity<ConfigSummaryDTO>> config() {
        return Mono.just(ResponseEntity.ok(inferenceService.getConfigSummary()));
    }
}
