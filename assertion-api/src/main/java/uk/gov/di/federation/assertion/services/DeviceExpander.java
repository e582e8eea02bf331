package uk.gov.di.federation.assertion.services;

import uk.gov.di.federation.assertion.entity.Device;
import uk.gov.di.federation.assertion.entity.ProviderDevice;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.isNull;

/**
 * Maps the devices OneLogin returns for a factor onto the choices offered to the user. A OneLogin
 * Protect device can either be used with a time-based code or be sent a push notification, so it
 * becomes two entries: the code entry first, then the push entry.
 */
public final class DeviceExpander {

    public static final String ONELOGIN_PROTECT = "OneLogin Protect";
    public static final String NOTIFY_ONELOGIN_PROTECT = "Notify to " + ONELOGIN_PROTECT;

    private DeviceExpander() {}

    public static List<Device> expand(ProviderDevice providerDevice) {
        int deviceId = providerDevice.deviceId();
        var otpEntry = new Device(deviceId, providerDevice.deviceType(), true);
        if (ONELOGIN_PROTECT.equals(providerDevice.deviceType())) {
            return List.of(otpEntry, new Device(deviceId, NOTIFY_ONELOGIN_PROTECT, false));
        }
        return List.of(otpEntry);
    }

    public static List<Device> expandAll(List<ProviderDevice> providerDevices) {
        List<Device> devices = new ArrayList<>();
        if (isNull(providerDevices)) {
            return devices;
        }
        for (ProviderDevice providerDevice : providerDevices) {
            devices.addAll(expand(providerDevice));
        }
        return devices;
    }
}
