package uk.gov.di.federation.login.interaction;

import uk.gov.di.federation.assertion.entity.Device;
import uk.gov.di.federation.login.exceptions.LoginInteractionException;

import java.util.List;

/** Asks the user which MFA device to use. Only called when there is more than one. */
@FunctionalInterface
public interface DeviceSelector {
    int chooseDeviceIndex(List<Device> devices) throws LoginInteractionException;
}
