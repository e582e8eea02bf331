package uk.gov.di.federation.shared.validation;

import java.util.List;

public interface Validator {
    List<String> validate(Object object);
}
