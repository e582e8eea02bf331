package uk.gov.di.federation.assertion.services;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import com.github.tomakehurst.wiremock.http.Fault;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import uk.gov.di.federation.assertion.entity.AuthenticationRequest;
import uk.gov.di.federation.assertion.entity.BearerToken;
import uk.gov.di.federation.assertion.entity.Device;
import uk.gov.di.federation.assertion.entity.FactorUser;
import uk.gov.di.federation.assertion.entity.PollingPolicy;
import uk.gov.di.federation.assertion.entity.ResponseStatus;
import uk.gov.di.federation.assertion.entity.VerificationRequest;
import uk.gov.di.federation.assertion.exceptions.BearerTokenUnavailableException;
import uk.gov.di.federation.assertion.exceptions.MfaTimeoutException;
import uk.gov.di.federation.assertion.exceptions.ProviderAuthenticationException;
import uk.gov.di.federation.assertion.exceptions.ProviderProtocolException;
import uk.gov.di.federation.assertion.exceptions.VerificationCancelledException;
import uk.gov.di.federation.shared.services.ConfigurationService;
import uk.gov.di.federation.sharedtest.logging.CaptureLoggingExtension;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.configureFor;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.exactly;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.stubFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.verify;
import static com.github.tomakehurst.wiremock.stubbing.Scenario.STARTED;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItem;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static uk.gov.di.federation.assertion.services.AssertionApiClient.SAML_ASSERTION_PATH;
import static uk.gov.di.federation.assertion.services.AssertionApiClient.VERIFY_FACTOR_PATH;
import static uk.gov.di.federation.sharedtest.logging.LogEventMatcher.withMessageContaining;

class SamlAssertionServiceTest {

    private static final String ACCESS_TOKEN = "access-token";
    private static final String PASSWORD = "correct-horse-battery-staple";
    private static final String APP_ID = "123456";
    private static final String SUBDOMAIN = "example";
    private static final String STATE_TOKEN = "5xxx604x8xx9x694xx860173xxx3x78x3x870x56";
    private static final String SAML_ASSERTION = "Base64 Encoded SAML Data";
    private static final String SUCCESS_RESPONSE =
            """
            {
                "status": {
                    "type": "success",
                    "message": "Success",
                    "error": false,
                    "code": 200
                },
                "data": "Base64 Encoded SAML Data"
            }
            """;
    private static final String PENDING_RESPONSE =
            """
            {
                "status": {
                    "message": "Authentication pending on OL Protect",
                    "error": false,
                    "type": "pending",
                    "code": 200
                }
            }
            """;
    private static final String ERROR_RESPONSE =
            """
            {
                "status": {
                    "type": "bad request",
                    "message": "Authorization Information is incorrect",
                    "error": true,
                    "code": 400
                }
            }
            """;
    private static final String EMPTY_SUCCESS_RESPONSE =
            """
            {
                "status": {
                    "type": "success",
                    "message": "Success",
                    "error": false,
                    "code": 200
                }
            }
            """;

    private final ConfigurationService configService = mock(ConfigurationService.class);
    private final BearerTokenSupplier bearerTokenSupplier =
            () ->
                    new BearerToken(
                            ACCESS_TOKEN,
                            "refresh-token",
                            Instant.now(),
                            Instant.now().plusSeconds(600),
                            Instant.now().plusSeconds(3600));

    @RegisterExtension
    private final CaptureLoggingExtension logging =
            new CaptureLoggingExtension(AssertionApiClient.class);

    private static WireMockServer wireMockServer;
    private static URI oneLoginUri;

    private SamlAssertionService samlAssertionService;

    @BeforeAll
    static void setUpWireMock() {
        wireMockServer = new WireMockServer(WireMockConfiguration.wireMockConfig().dynamicPort());
        wireMockServer.start();
        configureFor("localhost", wireMockServer.port());
        oneLoginUri = URI.create("http://localhost:" + wireMockServer.port());
    }

    @AfterAll
    static void afterAll() {
        wireMockServer.stop();
    }

    @BeforeEach
    void beforeEach() {
        when(configService.getOneLoginApiURI()).thenReturn(oneLoginUri);
        when(configService.getOneLoginApiCallTimeout()).thenReturn(500L);
        when(configService.getVerifyFactorMaxAttempts()).thenReturn(2);
        when(configService.getVerifyFactorAttemptInterval()).thenReturn(10L);
        samlAssertionService = new SamlAssertionService(configService, bearerTokenSupplier);
    }

    @AfterEach
    void afterEach() {
        wireMockServer.resetAll();
    }

    @Nested
    @DisplayName("Generating a SAML assertion")
    class Generate {

        private final AuthenticationRequest request =
                new AuthenticationRequest("username@example.com", PASSWORD, APP_ID, SUBDOMAIN);

        @Test
        void shouldReturnAssertionWhenNoMfaIsRequired() throws Exception {
            stubSamlAssertion(200, SUCCESS_RESPONSE);

            var result = samlAssertionService.generate(request);

            assertThat(result.isMfaRequired(), equalTo(false));
            assertThat(result.samlAssertion(), equalTo(SAML_ASSERTION));
            assertThat(
                    result.status(),
                    equalTo(
                            new ResponseStatus("success", "Success", false, 200)));
            assertThat(result.factors(), empty());
        }

        @Test
        void shouldSendCredentialsAsJsonWithBearerToken() throws Exception {
            stubSamlAssertion(200, SUCCESS_RESPONSE);

            samlAssertionService.generate(request);

            verify(
                    exactly(1),
                    postRequestedFor(urlPathEqualTo(SAML_ASSERTION_PATH))
                            .withHeader("Authorization", WireMock.equalTo("Bearer " + ACCESS_TOKEN))
                            .withHeader("Content-Type", WireMock.equalTo("application/json"))
                            .withRequestBody(
                                    equalToJson(
                                            """
                                            {
                                                "username_or_email": "username@example.com",
                                                "password": "correct-horse-battery-staple",
                                                "app_id": "123456",
                                                "subdomain": "example"
                                            }
                                            """)));
        }

        @Test
        void shouldReturnChallengeForOtpOnlyDevice() throws Exception {
            stubSamlAssertion(200, mfaRequiredResponse("Google Authenticator"));

            var result = samlAssertionService.generate(request);

            assertThat(result.isMfaRequired(), equalTo(true));
            assertThat(result.samlAssertion(), equalTo(""));
            assertThat(result.factors().size(), equalTo(1));
            var factor = result.factors().get(0);
            assertThat(factor.stateToken(), equalTo(STATE_TOKEN));
            assertThat(
                    factor.callbackUrl(),
                    equalTo(
                            "https://api.us.onelogin.com/api/1/saml_assertion/verify_factor"));
            assertThat(
                    factor.user(),
                    equalTo(
                            new FactorUser(
                                    12345678L, "username", "username@example.com", "名", "姓")));
            assertThat(
                    factor.devices(), contains(new Device(666666, "Google Authenticator", true)));
        }

        @Test
        void shouldOfferOtpAndPushForOneLoginProtect() throws Exception {
            stubSamlAssertion(200, mfaRequiredResponse("OneLogin Protect"));

            var result = samlAssertionService.generate(request);

            assertThat(
                    result.factors().get(0).devices(),
                    contains(
                            new Device(666666, "OneLogin Protect", true),
                            new Device(666666, "Notify to OneLogin Protect", false)));
        }

        @Test
        void shouldThrowProtocolExceptionForInvalidJson() {
            stubSamlAssertion(200, "invalid\n");

            assertThrows(
                    ProviderProtocolException.class, () -> samlAssertionService.generate(request));
        }

        @Test
        void shouldAcceptResponseServedAsPlainText() throws Exception {
            stubFor(
                    post(urlPathEqualTo(SAML_ASSERTION_PATH))
                            .willReturn(
                                    aResponse()
                                            .withStatus(200)
                                            .withHeader("Content-Type", "text/plain; charset=utf-8")
                                            .withBody(mfaRequiredResponse("OneLogin Protect"))));

            var result = samlAssertionService.generate(request);

            assertThat(result.isMfaRequired(), equalTo(true));
            assertThat(result.factors().get(0).devices().size(), equalTo(2));
        }

        @Test
        void shouldThrowProtocolExceptionForNullFactor() {
            stubSamlAssertion(
                    200,
                    """
                    {"status": {"type": "success", "message": "MFA is required for this user", "error": false, "code": 200}, "data": [null]}
                    """);

            assertThrows(
                    ProviderProtocolException.class, () -> samlAssertionService.generate(request));
        }

        @Test
        void shouldThrowProtocolExceptionForNullDeviceEntry() {
            stubSamlAssertion(
                    200,
                    """
                    {
                        "status": {"type": "success", "message": "MFA is required for this user", "error": false, "code": 200},
                        "data": [{"state_token": "state", "devices": [null]}]
                    }
                    """);

            assertThrows(
                    ProviderProtocolException.class, () -> samlAssertionService.generate(request));
        }

        @Test
        void shouldThrowProtocolExceptionForDeviceWithoutId() {
            stubSamlAssertion(
                    200,
                    """
                    {
                        "status": {"type": "success", "message": "MFA is required for this user", "error": false, "code": 200},
                        "data": [{"state_token": "state", "devices": [{"device_type": "Google Authenticator"}]}]
                    }
                    """);

            assertThrows(
                    ProviderProtocolException.class, () -> samlAssertionService.generate(request));
        }

        @Test
        void shouldThrowProtocolExceptionForFactorWithoutStateToken() {
            stubSamlAssertion(
                    200,
                    """
                    {
                        "status": {"type": "success", "message": "MFA is required for this user", "error": false, "code": 200},
                        "data": [{"devices": [{"device_id": 666666, "device_type": "Google Authenticator"}]}]
                    }
                    """);

            assertThrows(
                    ProviderProtocolException.class, () -> samlAssertionService.generate(request));
        }

        @Test
        void shouldThrowAuthenticationExceptionWithProviderMessageWhenRejected() {
            stubSamlAssertion(400, ERROR_RESPONSE);

            var exception =
                    assertThrows(
                            ProviderAuthenticationException.class,
                            () -> samlAssertionService.generate(request));

            assertThat(exception.getStatusCode(), equalTo(400));
            assertThat(
                    exception.getProviderMessage(),
                    equalTo("Authorization Information is incorrect"));
        }

        @Test
        void shouldThrowAuthenticationExceptionWhenNeitherAssertionNorChallengeReturned() {
            stubSamlAssertion(200, EMPTY_SUCCESS_RESPONSE);

            assertThrows(
                    ProviderAuthenticationException.class,
                    () -> samlAssertionService.generate(request));
        }

        @Test
        void shouldThrowAuthenticationExceptionForEmptyChallenge() {
            stubSamlAssertion(
                    200,
                    """
                    {"status": {"type": "success", "message": "MFA is required for this user", "error": false, "code": 200}, "data": []}
                    """);

            assertThrows(
                    ProviderAuthenticationException.class,
                    () -> samlAssertionService.generate(request));
        }

        @Test
        void shouldThrowAuthenticationExceptionForFactorWithoutDevices() {
            stubSamlAssertion(
                    200,
                    """
                    {
                        "status": {"type": "success", "message": "MFA is required for this user", "error": false, "code": 200},
                        "data": [{"state_token": "state", "devices": [], "callback_url": "https://example.com"}]
                    }
                    """);

            assertThrows(
                    ProviderAuthenticationException.class,
                    () -> samlAssertionService.generate(request));
        }

        @Test
        void shouldThrowProtocolExceptionWhenConnectionIsReset() {
            stubFor(
                    post(urlPathEqualTo(SAML_ASSERTION_PATH))
                            .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

            var exception =
                    assertThrows(
                            ProviderProtocolException.class,
                            () -> samlAssertionService.generate(request));

            assertThat(exception.getMessage(), containsString(SAML_ASSERTION_PATH));
        }

        @Test
        void shouldThrowProtocolExceptionWhenProviderIsTooSlow() {
            stubFor(
                    post(urlPathEqualTo(SAML_ASSERTION_PATH))
                            .willReturn(
                                    aResponse()
                                            .withStatus(200)
                                            .withBody(SUCCESS_RESPONSE)
                                            .withFixedDelay(2000)));

            var exception =
                    assertThrows(
                            ProviderProtocolException.class,
                            () -> samlAssertionService.generate(request));

            assertThat(exception.getMessage(), containsString("timeout of 500"));
        }

        @Test
        void shouldNotSendRequestWhenNoBearerTokenIsAvailable() {
            samlAssertionService =
                    new SamlAssertionService(
                            configService,
                            () -> {
                                throw new BearerTokenUnavailableException("token endpoint down");
                            });

            assertThrows(
                    BearerTokenUnavailableException.class,
                    () -> samlAssertionService.generate(request));
            verify(exactly(0), postRequestedFor(urlPathEqualTo(SAML_ASSERTION_PATH)));
        }

        @Test
        void shouldNotLogTheUsersPassword() throws Exception {
            stubSamlAssertion(200, SUCCESS_RESPONSE);

            samlAssertionService.generate(request);

            assertThat(logging.events(), not(hasItem(withMessageContaining(PASSWORD))));
            assertThat(
                    logging.events(),
                    hasItem(withMessageContaining("Received HTTP status 200 from OneLogin")));
        }
    }

    @Nested
    @DisplayName("Verifying an MFA factor")
    class VerifyFactor {

        private final VerificationRequest otpRequest =
                new VerificationRequest(APP_ID, "666666", STATE_TOKEN, "123456", true);
        private final VerificationRequest pushRequest =
                new VerificationRequest(APP_ID, "666666", STATE_TOKEN, "", false);
        private final PollingPolicy policy = new PollingPolicy(2, Duration.ofMillis(100));

        @Test
        void shouldReturnAssertionWhenOtpIsAccepted() throws Exception {
            stubVerifyFactor(200, SUCCESS_RESPONSE);

            var result = samlAssertionService.verifyFactor(otpRequest, policy);

            assertThat(result.samlAssertion(), equalTo(SAML_ASSERTION));
            verify(
                    exactly(1),
                    postRequestedFor(urlPathEqualTo(VERIFY_FACTOR_PATH))
                            .withHeader("Authorization", WireMock.equalTo("Bearer " + ACCESS_TOKEN))
                            .withRequestBody(
                                    equalToJson(
                                            """
                                            {
                                                "app_id": "123456",
                                                "device_id": "666666",
                                                "state_token": "5xxx604x8xx9x694xx860173xxx3x78x3x870x56",
                                                "otp_token": "123456",
                                                "do_not_notify": true
                                            }
                                            """)));
        }

        @Test
        void shouldKeepPollingWhilePushIsPendingAndNeverNotifyTwice() throws Exception {
            stubFor(
                    post(urlPathEqualTo(VERIFY_FACTOR_PATH))
                            .inScenario("push confirmation")
                            .whenScenarioStateIs(STARTED)
                            .willReturn(aResponse().withStatus(200).withBody(PENDING_RESPONSE))
                            .willSetStateTo("confirmed"));
            stubFor(
                    post(urlPathEqualTo(VERIFY_FACTOR_PATH))
                            .inScenario("push confirmation")
                            .whenScenarioStateIs("confirmed")
                            .willReturn(aResponse().withStatus(200).withBody(SUCCESS_RESPONSE)));

            var result = samlAssertionService.verifyFactor(pushRequest, policy);

            assertThat(result.samlAssertion(), equalTo(SAML_ASSERTION));
            verify(exactly(2), postRequestedFor(urlPathEqualTo(VERIFY_FACTOR_PATH)));
            verify(
                    exactly(1),
                    postRequestedFor(urlPathEqualTo(VERIFY_FACTOR_PATH))
                            .withRequestBody(
                                    equalToJson(
                                            """
                                            {
                                                "app_id": "123456",
                                                "device_id": "666666",
                                                "state_token": "5xxx604x8xx9x694xx860173xxx3x78x3x870x56",
                                                "otp_token": "",
                                                "do_not_notify": false
                                            }
                                            """)));
            verify(
                    exactly(1),
                    postRequestedFor(urlPathEqualTo(VERIFY_FACTOR_PATH))
                            .withRequestBody(
                                    equalToJson(
                                            """
                                            {
                                                "app_id": "123456",
                                                "device_id": "666666",
                                                "state_token": "5xxx604x8xx9x694xx860173xxx3x78x3x870x56",
                                                "otp_token": "",
                                                "do_not_notify": true
                                            }
                                            """)));
        }

        @Test
        void shouldClearOtpAndSuppressNotificationOnRetriesWhateverTheFirstRequestSent()
                throws Exception {
            var unusualRequest =
                    new VerificationRequest(APP_ID, "666666", STATE_TOKEN, "654321", false);
            stubFor(
                    post(urlPathEqualTo(VERIFY_FACTOR_PATH))
                            .inScenario("retry")
                            .whenScenarioStateIs(STARTED)
                            .willReturn(aResponse().withStatus(200).withBody(PENDING_RESPONSE))
                            .willSetStateTo("second attempt"));
            stubFor(
                    post(urlPathEqualTo(VERIFY_FACTOR_PATH))
                            .inScenario("retry")
                            .whenScenarioStateIs("second attempt")
                            .willReturn(aResponse().withStatus(200).withBody(SUCCESS_RESPONSE)));

            samlAssertionService.verifyFactor(unusualRequest, policy);

            verify(
                    exactly(1),
                    postRequestedFor(urlPathEqualTo(VERIFY_FACTOR_PATH))
                            .withRequestBody(
                                    equalToJson(
                                            "{\"otp_token\": \"\", \"do_not_notify\": true}",
                                            false,
                                            true)));
        }

        @Test
        void shouldGiveUpAfterMaxAttemptsWhenPushIsNeverConfirmed() {
            stubVerifyFactor(200, PENDING_RESPONSE);

            var exception =
                    assertThrows(
                            MfaTimeoutException.class,
                            () -> samlAssertionService.verifyFactor(pushRequest, policy));

            assertThat(exception.getAttempts(), equalTo(2));
            verify(exactly(2), postRequestedFor(urlPathEqualTo(VERIFY_FACTOR_PATH)));
        }

        @Test
        void shouldTimeOutAfterSingleAttemptWhenOnlyOneIsAllowed() {
            stubVerifyFactor(200, PENDING_RESPONSE);

            assertThrows(
                    MfaTimeoutException.class,
                    () ->
                            samlAssertionService.verifyFactor(
                                    pushRequest, new PollingPolicy(1, Duration.ofSeconds(30))));
            verify(exactly(1), postRequestedFor(urlPathEqualTo(VERIFY_FACTOR_PATH)));
        }

        @Test
        void shouldUseConfiguredPollingPolicyByDefault() {
            stubVerifyFactor(200, PENDING_RESPONSE);

            assertThrows(
                    MfaTimeoutException.class,
                    () -> samlAssertionService.verifyFactor(pushRequest));
            verify(exactly(2), postRequestedFor(urlPathEqualTo(VERIFY_FACTOR_PATH)));
        }

        @Test
        void shouldStopPollingWhenProviderRejectsTheFactor() {
            stubVerifyFactor(400, ERROR_RESPONSE);

            var exception =
                    assertThrows(
                            ProviderAuthenticationException.class,
                            () -> samlAssertionService.verifyFactor(otpRequest, policy));

            assertThat(exception.getStatusCode(), equalTo(400));
            verify(exactly(1), postRequestedFor(urlPathEqualTo(VERIFY_FACTOR_PATH)));
        }

        @Test
        void shouldStopPollingOnInvalidJson() {
            stubVerifyFactor(200, "invalid\n");

            assertThrows(
                    ProviderProtocolException.class,
                    () -> samlAssertionService.verifyFactor(otpRequest, policy));
            verify(exactly(1), postRequestedFor(urlPathEqualTo(VERIFY_FACTOR_PATH)));
        }

        @Test
        void shouldRejectUnrecognisedStatusType() {
            stubVerifyFactor(
                    200,
                    """
                    {"status": {"type": "waiting", "message": "Hold on", "error": false, "code": 200}}
                    """);

            var exception =
                    assertThrows(
                            ProviderAuthenticationException.class,
                            () -> samlAssertionService.verifyFactor(otpRequest, policy));

            assertThat(exception.getStatusType(), equalTo("waiting"));
        }

        @Test
        void shouldRejectSuccessWithoutAssertion() {
            stubVerifyFactor(200, EMPTY_SUCCESS_RESPONSE);

            assertThrows(
                    ProviderAuthenticationException.class,
                    () -> samlAssertionService.verifyFactor(otpRequest, policy));
            verify(exactly(1), postRequestedFor(urlPathEqualTo(VERIFY_FACTOR_PATH)));
        }

        @Test
        void shouldNotSendAnyRequestWhenAlreadyCancelled() {
            var signal = new CancellationSignal();
            signal.cancel();

            assertThrows(
                    VerificationCancelledException.class,
                    () -> samlAssertionService.verifyFactor(pushRequest, policy, signal));
            verify(exactly(0), postRequestedFor(urlPathEqualTo(VERIFY_FACTOR_PATH)));
        }
    }

    private static void stubSamlAssertion(int status, String body) {
        stubFor(
                post(urlPathEqualTo(SAML_ASSERTION_PATH))
                        .willReturn(
                                aResponse()
                                        .withStatus(status)
                                        .withHeader("Content-Type", "application/json")
                                        .withBody(body)));
    }

    private static void stubVerifyFactor(int status, String body) {
        stubFor(
                post(urlPathEqualTo(VERIFY_FACTOR_PATH))
                        .willReturn(
                                aResponse()
                                        .withStatus(status)
                                        .withHeader("Content-Type", "application/json")
                                        .withBody(body)));
    }

    private static String mfaRequiredResponse(String deviceType) {
        return """
                {
                    "status": {
                        "type": "success",
                        "message": "MFA is required for this user",
                        "error": false,
                        "code": 200
                    },
                    "data": [
                        {
                            "state_token": "5xxx604x8xx9x694xx860173xxx3x78x3x870x56",
                            "devices": [
                                {
                                    "device_id": 666666,
                                    "device_type": "%s"
                                }
                            ],
                            "callback_url": "https://api.us.onelogin.com/api/1/saml_assertion/verify_factor",
                            "user": {
                                "lastname": "姓",
                                "username": "username",
                                "email": "username@example.com",
                                "firstname": "名",
                                "id": 12345678
                            }
                        }
                    ]
                }
                """
                .formatted(deviceType);
    }
}
