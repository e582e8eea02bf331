package uk.gov.di.federation.assertion.entity;

import java.util.List;

public record Factor(String stateToken, List<Device> devices, String callbackUrl, FactorUser user) {

    public Factor {
        devices = List.copyOf(devices);
    }
}
