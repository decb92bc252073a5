package com.equixtate.domain;

import java.time.Instant;

/**
 * One entry of a record's status history; from is null for the initial state.
 */
public record StatusChange(String from, String to, Instant at) {
}
