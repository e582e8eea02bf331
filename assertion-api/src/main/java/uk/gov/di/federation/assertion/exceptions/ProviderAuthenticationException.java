package uk.gov.di.federation.assertion.exceptions;

import uk.gov.di.federation.assertion.entity.ResponseStatus;

import static java.lang.String.format;
import static java.util.Objects.nonNull;

/** The provider rejected the request, or answered with a status the client cannot act on. */
public class ProviderAuthenticationException extends SamlAssertionException {

    private final int statusCode;
    private final String providerMessage;
    private final String statusType;

    public ProviderAuthenticationException(
            String message, int statusCode, String providerMessage, String statusType) {
        super(message);
        this.statusCode = statusCode;
        this.providerMessage = providerMessage;
        this.statusType = statusType;
    }

    public static ProviderAuthenticationException rejectedException(
            int httpStatusCode, ResponseStatus status) {
        var code = nonNull(status.code()) ? status.code() : httpStatusCode;
        return new ProviderAuthenticationException(
                format(
                        "OneLogin rejected the request with HTTP status %d and code %d: %s",
                        httpStatusCode, code, status.message()),
                code,
                status.message(),
                status.type());
    }

    public static ProviderAuthenticationException unrecognisedStatusException(
            ResponseStatus status) {
        return new ProviderAuthenticationException(
                format(
                        "Unrecognised response status from OneLogin: type=%s, message=%s",
                        status.type(), status.message()),
                codeOf(status),
                status.message(),
                status.type());
    }

    public static ProviderAuthenticationException emptyResponseException(ResponseStatus status) {
        return new ProviderAuthenticationException(
                "OneLogin response contained neither a SAML assertion nor an MFA challenge",
                codeOf(status),
                status.message(),
                status.type());
    }

    public static ProviderAuthenticationException noDevicesException(ResponseStatus status) {
        return new ProviderAuthenticationException(
                "OneLogin MFA challenge contained a factor with no devices",
                codeOf(status),
                status.message(),
                status.type());
    }

    private static int codeOf(ResponseStatus status) {
        return nonNull(status.code()) ? status.code() : 0;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getProviderMessage() {
        return providerMessage;
    }

    public String getStatusType() {
        return statusType;
    }
}
