package com.equixtate.api.controller;

import com.equixtate.api.dto.AdminNoteRequest;
import com.equixtate.api.dto.CreatePropertyRequest;
import com.equixtate.api.dto.DocumentPayload;
import com.equixtate.api.dto.PropertyOnboardingResponse;
import com.equixtate.api.dto.VerificationResponse;
import com.equixtate.domain.PropertyFields;
import com.equixtate.domain.PropertyOnboarding;
import com.equixtate.onboarding.property.PropertyOnboardingWorkflow;
import com.equixtate.onboarding.property.PropertySubmission;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * Property onboarding: create, verify, tokenize, annotate and read.
 * Verification and tokenization call external services and run off the event loop.
 */
@RestController
@RequestMapping("/api/v1/properties")
@RequiredArgsConstructor
public class PropertyOnboardingController {

    private final PropertyOnboardingWorkflow workflow;

    @PostMapping
    public ResponseEntity<PropertyOnboardingResponse> create(@Valid @RequestBody CreatePropertyRequest request) {
        PropertyFields fields = PropertyFields.builder()
                .name(request.name())
                .propertyType(request.propertyType())
                .location(request.location())
                .description(request.description())
                .price(request.price())
                .bedrooms(request.bedrooms())
                .bathrooms(request.bathrooms())
                .squareFootage(request.squareFootage())
                .listingType(request.listingType())
                .build();
        PropertySubmission submission = new PropertySubmission(request.ownerPrincipal().trim(), fields,
                DocumentPayload.toUploadOrNull(request.deed()),
                DocumentPayload.toUploads(request.images()),
                DocumentPayload.toUploads(request.supportingDocs()));
        PropertyOnboarding created = workflow.createOnboarding(submission);
        return ResponseEntity.status(HttpStatus.CREATED).body(PropertyOnboardingResponse.from(created));
    }

    @GetMapping("/{id}")
    public PropertyOnboardingResponse get(@PathVariable String id) {
        return PropertyOnboardingResponse.from(workflow.getOnboarding(id));
    }

    @GetMapping
    public List<PropertyOnboardingResponse> list(@RequestParam(required = false) String owner) {
        List<PropertyOnboarding> records = owner != null && !owner.isBlank()
                ? workflow.getByPrincipal(owner)
                : workflow.listAll();
        return records.stream().map(PropertyOnboardingResponse::from).toList();
    }

    @GetMapping("/pending")
    public List<PropertyOnboardingResponse> pending() {
        return workflow.listPending().stream().map(PropertyOnboardingResponse::from).toList();
    }

    @PostMapping("/{id}/verification")
    public Mono<VerificationResponse> submitForVerification(@PathVariable String id) {
        return Mono.fromCallable(() -> {
                    var result = workflow.submitForVerification(id);
                    PropertyOnboarding record = workflow.getOnboarding(id);
                    return new VerificationResponse(id, record.getStatus().name(), result);
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/tokenization")
    public Mono<PropertyOnboardingResponse> tokenize(@PathVariable String id) {
        return Mono.fromCallable(() -> PropertyOnboardingResponse.from(workflow.tokenize(id)))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/{id}/notes")
    public PropertyOnboardingResponse annotate(@PathVariable String id, @Valid @RequestBody AdminNoteRequest request) {
        return PropertyOnboardingResponse.from(workflow.annotate(id, request.note()));
    }
}
