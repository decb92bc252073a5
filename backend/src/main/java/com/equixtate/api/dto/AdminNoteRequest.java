package com.equixtate.api.dto;

import jakarta.validation.constraints.NotBlank;

public record AdminNoteRequest(@NotBlank(message = "INVALID_FIELDS") String note) {
}
