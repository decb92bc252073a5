package com.equixtate.api.controller;

import com.equixtate.api.dto.DocumentPayload;
import com.equixtate.api.dto.EligibilityResponse;
import com.equixtate.api.dto.ErrorBody;
import com.equixtate.api.dto.KycRequest;
import com.equixtate.api.dto.UserOnboardingResponse;
import com.equixtate.api.dto.VerificationResponse;
import com.equixtate.api.validation.AddressValidator;
import com.equixtate.domain.PersonalInfo;
import com.equixtate.onboarding.user.Eligibility;
import com.equixtate.onboarding.user.KycSubmission;
import com.equixtate.onboarding.user.UserVerificationWorkflow;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;

/**
 * User KYC: create-or-get, submit, eligibility checks and the pending queue.
 */
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserOnboardingController {

    private final UserVerificationWorkflow workflow;
    private final AddressValidator addressValidator;
    private final Clock clock;

    @PutMapping("/{principal}")
    public ResponseEntity<?> createOrGet(@PathVariable String principal) {
        if (!addressValidator.isValidAddress(principal)) {
            return invalidAddress();
        }
        return ResponseEntity.ok(UserOnboardingResponse.from(workflow.createOrGetOnboarding(principal.trim()),
                clock.instant()));
    }

    @GetMapping("/{principal}")
    public ResponseEntity<?> get(@PathVariable String principal) {
        if (!addressValidator.isValidAddress(principal)) {
            return invalidAddress();
        }
        return workflow.getByPrincipal(principal)
                .<ResponseEntity<?>>map(u -> ResponseEntity.ok(UserOnboardingResponse.from(u, clock.instant())))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping("/{principal}/kyc")
    public Mono<ResponseEntity<Object>> submitKyc(@PathVariable String principal, @RequestBody KycRequest request) {
        if (!addressValidator.isValidAddress(principal)) {
            return Mono.just(ResponseEntity.badRequest()
                    .<Object>body(ErrorBody.of("INVALID_ADDRESS", "Invalid wallet address")));
        }
        KycSubmission submission = new KycSubmission(principal.trim(),
                PersonalInfo.builder()
                        .fullName(request.fullName())
                        .email(request.email())
                        .country(request.country())
                        .dateOfBirth(request.dateOfBirth())
                        .nationality(request.nationality())
                        .build(),
                request.identityType(),
                DocumentPayload.toUploadOrNull(request.identityDocument()),
                DocumentPayload.toUploadOrNull(request.addressProof()),
                request.targetTier());
        return Mono.fromCallable(() -> {
                    var result = workflow.submitKYC(submission);
                    String status = workflow.effectiveStatus(principal).name();
                    return ResponseEntity.<Object>ok(new VerificationResponse(principal.trim(), status, result));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/{principal}/eligibility/investment")
    public EligibilityResponse canInvest(@PathVariable String principal, @RequestParam BigDecimal amount) {
        return toResponse(principal, workflow.canInvest(principal, amount));
    }

    @GetMapping("/{principal}/eligibility/listing")
    public EligibilityResponse canList(@PathVariable String principal) {
        return toResponse(principal, workflow.canListProperty(principal));
    }

    @GetMapping("/pending")
    public List<UserOnboardingResponse> pending() {
        return workflow.listPending().stream()
                .map(u -> UserOnboardingResponse.from(u, clock.instant()))
                .toList();
    }

    private static EligibilityResponse toResponse(String principal, Eligibility eligibility) {
        return new EligibilityResponse(principal, eligibility.allowed(), eligibility.reason());
    }

    private static ResponseEntity<?> invalidAddress() {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_ADDRESS", "Invalid wallet address"));
    }
}
