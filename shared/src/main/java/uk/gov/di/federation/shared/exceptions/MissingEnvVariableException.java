package uk.gov.di.federation.shared.exceptions;

public class MissingEnvVariableException extends RuntimeException {
    public MissingEnvVariableException(String variableName) {
        super("Missing required environment variable: " + variableName);
    }
}
