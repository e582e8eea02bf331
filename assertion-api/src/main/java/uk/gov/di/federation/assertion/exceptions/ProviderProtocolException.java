package uk.gov.di.federation.assertion.exceptions;

import java.io.IOException;
import java.net.http.HttpTimeoutException;

import static java.lang.String.format;

public class ProviderProtocolException extends SamlAssertionException {

    public ProviderProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ProviderProtocolException ioException(String path, IOException e) {
        return new ProviderProtocolException(
                format("Error when attempting to call OneLogin endpoint %s", path), e);
    }

    public static ProviderProtocolException interruptedException(
            String path, InterruptedException e) {
        return new ProviderProtocolException(
                format("Interrupted exception when attempting to call OneLogin endpoint %s", path),
                e);
    }

    public static ProviderProtocolException timeoutException(
            String path, long timeout, HttpTimeoutException e) {
        return new ProviderProtocolException(
                format(
                        "Timeout when calling OneLogin endpoint %s with timeout of %d",
                        path, timeout),
                e);
    }

    public static ProviderProtocolException parseException(int statusCode, Exception e) {
        return new ProviderProtocolException(
                format("Error parsing OneLogin response with HTTP status %d", statusCode), e);
    }
}
