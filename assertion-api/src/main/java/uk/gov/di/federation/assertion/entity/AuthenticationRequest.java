package uk.gov.di.federation.assertion.entity;

import com.google.gson.annotations.Expose;

public record AuthenticationRequest(
        @Expose String usernameOrEmail,
        @Expose String password,
        @Expose String appId,
        @Expose String subdomain,
        @Expose String ipAddress) {

    public AuthenticationRequest(
            String usernameOrEmail, String password, String appId, String subdomain) {
        this(usernameOrEmail, password, appId, subdomain, null);
    }

    @Override
    public String toString() {
        return "AuthenticationRequest[appId="
                + appId
                + ", subdomain="
                + subdomain
                + ", ipAddress="
                + ipAddress
                + "]";
    }
}
