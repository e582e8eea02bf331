package uk.gov.di.federation.login.exceptions;

public class LoginInteractionException extends Exception {

    public LoginInteractionException(String message) {
        super(message);
    }

    public LoginInteractionException(String message, Throwable cause) {
        super(message, cause);
    }

    public static LoginInteractionException invalidDeviceIndex(int index, int deviceCount) {
        return new LoginInteractionException(
                String.format(
                        "Selected device index %d is outside the %d available devices",
                        index, deviceCount));
    }
}
