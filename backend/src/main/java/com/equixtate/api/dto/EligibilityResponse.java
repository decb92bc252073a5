package com.equixtate.api.dto;

public record EligibilityResponse(String principal, boolean allowed, String reason) {
}
