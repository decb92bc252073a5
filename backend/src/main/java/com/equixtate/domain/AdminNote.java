package com.equixtate.domain;

import java.time.Instant;

public record AdminNote(Instant at, String note) {
}
