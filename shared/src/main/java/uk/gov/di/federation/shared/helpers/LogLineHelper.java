package uk.gov.di.federation.shared.helpers;

import org.apache.logging.log4j.ThreadContext;

import static java.util.Objects.isNull;

public class LogLineHelper {

    public static final String UNKNOWN = "unknown";

    public enum LogFieldName {
        APP_ID("appId"),
        SUBDOMAIN("subdomain"),
        DEVICE_ID("deviceId");

        private final String logFieldName;

        LogFieldName(String fieldName) {
            this.logFieldName = fieldName;
        }

        public String getLogFieldName() {
            return logFieldName;
        }
    }

    private LogLineHelper() {}

    public static void attachLogFieldToLogs(LogFieldName logFieldName, String value) {
        ThreadContext.put(
                logFieldName.getLogFieldName(),
                isNull(value) || value.isBlank() ? UNKNOWN : value);
    }

    public static void detachLogFieldsFromLogs() {
        for (var logFieldName : LogFieldName.values()) {
            ThreadContext.remove(logFieldName.getLogFieldName());
        }
    }
}
