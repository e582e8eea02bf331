package uk.gov.di.federation.assertion.entity;

import com.google.gson.annotations.Expose;
import com.google.gson.annotations.SerializedName;

public record FactorUser(
        @Expose Long id,
        @Expose String username,
        @Expose String email,
        @Expose @SerializedName("firstname") String firstName,
        @Expose @SerializedName("lastname") String lastName) {}
