package uk.gov.di.federation.login.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.services.sts.model.Credentials;
import uk.gov.di.federation.assertion.entity.AuthenticationRequest;
import uk.gov.di.federation.assertion.entity.Device;
import uk.gov.di.federation.assertion.entity.Factor;
import uk.gov.di.federation.assertion.entity.VerificationRequest;
import uk.gov.di.federation.assertion.exceptions.SamlAssertionException;
import uk.gov.di.federation.assertion.services.SamlAssertionService;
import uk.gov.di.federation.login.entity.LoginParameters;
import uk.gov.di.federation.login.exceptions.LoginInteractionException;
import uk.gov.di.federation.login.exceptions.RoleAssumptionException;
import uk.gov.di.federation.login.interaction.DeviceSelector;
import uk.gov.di.federation.login.interaction.OtpPrompt;
import uk.gov.di.federation.shared.services.ConfigurationService;

import static uk.gov.di.federation.login.exceptions.LoginInteractionException.invalidDeviceIndex;
import static uk.gov.di.federation.shared.helpers.LogLineHelper.LogFieldName.APP_ID;
import static uk.gov.di.federation.shared.helpers.LogLineHelper.LogFieldName.DEVICE_ID;
import static uk.gov.di.federation.shared.helpers.LogLineHelper.LogFieldName.SUBDOMAIN;
import static uk.gov.di.federation.shared.helpers.LogLineHelper.attachLogFieldToLogs;
import static uk.gov.di.federation.shared.helpers.LogLineHelper.detachLogFieldsFromLogs;

/** Runs a whole login: credentials, optional MFA, then role assumption. */
public class LoginService {

    private static final Logger LOG = LogManager.getLogger(LoginService.class);

    private final SamlAssertionService samlAssertionService;
    private final RoleAssumptionService roleAssumptionService;

    public LoginService(ConfigurationService configurationService) {
        this(
                new SamlAssertionService(
                        configurationService,
                        new ClientCredentialsTokenSupplier(configurationService)),
                new RoleAssumptionService(configurationService));
    }

    public LoginService(
            SamlAssertionService samlAssertionService,
            RoleAssumptionService roleAssumptionService) {
        this.samlAssertionService = samlAssertionService;
        this.roleAssumptionService = roleAssumptionService;
    }

    public Credentials login(
            LoginParameters parameters, DeviceSelector deviceSelector, OtpPrompt otpPrompt)
            throws SamlAssertionException, LoginInteractionException, RoleAssumptionException {
        attachLogFieldToLogs(APP_ID, parameters.appId());
        attachLogFieldToLogs(SUBDOMAIN, parameters.subdomain());
        try {
            LOG.info("Starting login");
            var samlAssertion = obtainSamlAssertion(parameters, deviceSelector, otpPrompt);
            return roleAssumptionService.assumeRole(
                    parameters.principalArn(),
                    parameters.roleArn(),
                    samlAssertion,
                    parameters.durationSeconds());
        } finally {
            detachLogFieldsFromLogs();
        }
    }

    private String obtainSamlAssertion(
            LoginParameters parameters, DeviceSelector deviceSelector, OtpPrompt otpPrompt)
            throws SamlAssertionException, LoginInteractionException {
        var assertion =
                samlAssertionService.generate(
                        new AuthenticationRequest(
                                parameters.usernameOrEmail(),
                                parameters.password(),
                                parameters.appId(),
                                parameters.subdomain()));
        if (!assertion.isMfaRequired()) {
            return assertion.samlAssertion();
        }

        var factor = assertion.factors().get(0);
        var device = selectDevice(factor, deviceSelector);
        attachLogFieldToLogs(DEVICE_ID, String.valueOf(device.deviceId()));
        LOG.info("Using MFA device of type {}", device.deviceType());

        var otpToken = device.requiresOtpToken() ? otpPrompt.requestOtpToken() : "";
        var request =
                VerificationRequest.forDevice(
                        parameters.appId(), device, factor.stateToken(), otpToken);
        return samlAssertionService.verifyFactor(request).samlAssertion();
    }

    private Device selectDevice(Factor factor, DeviceSelector deviceSelector)
            throws LoginInteractionException {
        var devices = factor.devices();
        if (devices.size() == 1) {
            return devices.get(0);
        }
        int selected = deviceSelector.chooseDeviceIndex(devices);
        if (selected < 0 || selected >= devices.size()) {
            throw invalidDeviceIndex(selected, devices.size());
        }
        return devices.get(selected);
    }
}
