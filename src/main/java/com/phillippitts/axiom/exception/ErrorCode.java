package com.phillippitts.axiom.exception;

/**
 * Stable error codes in {@code MODULE-NNN} form, grouped by subsystem prefix.
 *
 * <p>Codes are safe to show to operators and clients; {@link #userMessage()} is the
 * end-user wording for the code's subsystem and never includes technical detail.
 */
public enum ErrorCode {

    BUS_DELIVERY_FAILED("BUS-001"),
    BUS_INVALID_EVENT("BUS-002"),
    BUS_UNREGISTERED_TOPIC("BUS-003"),
    BUS_SHUT_DOWN("BUS-006"),

    STATE_CONNECTION_FAILED("STATE-001"),
    STATE_QUERY_FAILED("STATE-002"),
    STATE_INTEGRITY_ERROR("STATE-006"),

    POLICY_VALIDATION_FAILED("POLICY-001"),
    POLICY_EVALUATION_ERROR("POLICY-004"),

    VA_RESPONSE_GENERATION_FAILED("VA-002"),
    VA_PIPELINE_ERROR("VA-004"),
    VA_CONTEXT_ERROR("VA-005"),

    SYSTEM_RESOURCE_EXHAUSTED("SYSTEM-004"),
    SYSTEM_TIMEOUT("SYSTEM-005");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Returns the subsystem prefix ({@code BUS}, {@code STATE}, ...).
     */
    public String module() {
        return code.substring(0, code.indexOf('-'));
    }

    public String userMessage() {
        return switch (module()) {
            case "BUS" -> "There was a communication issue between system components. Please try again.";
            case "STATE" -> "There was an issue saving or retrieving your conversation. Please try again.";
            case "POLICY" -> "Your request could not be processed due to content restrictions.";
            case "VA" -> "I'm having trouble understanding right now. Please try again.";
            default -> "A system error occurred. Please try again in a moment.";
        };
    }

    @Override
    public String toString() {
        return code;
    }
}
