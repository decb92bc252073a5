package com.equixtate.domain;

import lombok.Builder;

@Builder
public record PersonalInfo(String fullName, String email, String country, String dateOfBirth, String nationality) {

    public static final PersonalInfo EMPTY = new PersonalInfo(null, null, null, null, null);
}
