package uk.gov.di.federation.login.entity;

public record LoginParameters(
        String usernameOrEmail,
        String password,
        String appId,
        String subdomain,
        String principalArn,
        String roleArn,
        long durationSeconds) {

    @Override
    public String toString() {
        return "LoginParameters[appId="
                + appId
                + ", subdomain="
                + subdomain
                + ", principalArn="
                + principalArn
                + ", roleArn="
                + roleArn
                + ", durationSeconds="
                + durationSeconds
                + "]";
    }
}
