package uk.gov.di.federation.assertion.entity;

import com.google.gson.annotations.Expose;

public record ResponseStatus(
        @Expose String type, @Expose String message, @Expose Boolean error, @Expose Integer code) {

    public static final String SUCCESS = "success";
    public static final String PENDING = "pending";

    public boolean isError() {
        return Boolean.TRUE.equals(error);
    }

    public boolean hasType(String expected) {
        return expected.equalsIgnoreCase(type);
    }
}
