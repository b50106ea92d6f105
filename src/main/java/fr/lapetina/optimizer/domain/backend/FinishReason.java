package fr.lapetina.optimizer.domain.backend;

/**
 * Why the backend stopped generating.
 */
public enum FinishReason {
    /** Natural end of the answer */
    STOP,

    /** Token limit reached, the text is truncated */
    LENGTH,

    /** Backend did not say */
    UNKNOWN;

    public static FinishReason fromWire(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        return switch (value.toLowerCase()) {
            case "stop", "end_turn", "stop_sequence" -> STOP;
            case "length", "max_tokens" -> LENGTH;
            default -> UNKNOWN;
        };
    }
}
