package uk.gov.di.federation.login.exceptions;

public class RoleAssumptionException extends Exception {

    public RoleAssumptionException(String message) {
        super(message);
    }

    public RoleAssumptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
