package org.hardshell.loader;

/**
 * Fatal loader error. Thrown out of the startup path so the process dies instead of running half-loaded code.
 */
public class LoaderFailure extends RuntimeException {

    public enum Reason {
        PAYLOAD_CORRUPT,
        KEY_UNAVAILABLE,
        AUTHENTICATION_FAILURE,
        UNSUPPORTED_PLATFORM_CAPABILITY,
        NATIVE_LIBRARY_MISSING_FOR_ABI,
        ORIGINAL_APPLICATION_CONSTRUCTION_FAILED,
        DEBUGGER_DETECTED
    }

    private final Reason reason;

    public LoaderFailure(Reason reason, String message) {
        super(reason + ": " + message);
        this.reason = reason;
    }

    public LoaderFailure(Reason reason, String message, Throwable cause) {
        super(reason + ": " + message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
