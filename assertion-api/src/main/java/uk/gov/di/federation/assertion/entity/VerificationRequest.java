package uk.gov.di.federation.assertion.entity;

import com.google.gson.annotations.Expose;

/**
 * Body of a {@code verify_factor} call.
 *
 * <p>{@code doNotNotify=false} asks the provider to send a push to the device, {@code true}
 * checks on a push that has already been sent (or verifies an OTP without notifying).
 */
public record VerificationRequest(
        @Expose String appId,
        @Expose String deviceId,
        @Expose String stateToken,
        @Expose String otpToken,
        @Expose boolean doNotNotify) {

    public static VerificationRequest forDevice(
            String appId, Device device, String stateToken, String otpToken) {
        var otp = otpToken == null ? "" : otpToken;
        return new VerificationRequest(
                appId, String.valueOf(device.deviceId()), stateToken, otp, !otp.isEmpty());
    }

    /** The request sent on every attempt after the first: no notification, no OTP. */
    public VerificationRequest forRetry() {
        return new VerificationRequest(appId, deviceId, stateToken, "", true);
    }

    @Override
    public String toString() {
        return "VerificationRequest[appId="
                + appId
                + ", deviceId="
                + deviceId
                + ", doNotNotify="
                + doNotNotify
                + "]";
    }
}
