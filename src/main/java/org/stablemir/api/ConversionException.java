package org.stablemir.api;

/**
 * Thrown when the conversion of a compiler construct has to stop. The query that triggered it
 * is abandoned as a whole; no partial result is ever returned.
 */
public class ConversionException extends RuntimeException {

    private final ConversionErrorCode code;
    private final String construct;

    /**
     * @param code      Why conversion stopped.
     * @param construct Name of the compiler construct, e.g. {@code StatementKind.StorageLive}.
     */
    public ConversionException(ConversionErrorCode code, String construct) {
        super(messageFor(code, construct));
        this.code = code;
        this.construct = construct;
    }

    public static ConversionException notYetImplemented(String construct) {
        return new ConversionException(ConversionErrorCode.NOT_YET_IMPLEMENTED, construct);
    }

    public static ConversionException invariantViolated(String construct) {
        return new ConversionException(ConversionErrorCode.INVARIANT_VIOLATED, construct);
    }

    public ConversionErrorCode code() {
        return code;
    }

    public String construct() {
        return construct;
    }

    private static String messageFor(ConversionErrorCode code, String construct) {
        return switch (code) {
            case NOT_YET_IMPLEMENTED -> "No stable representation for " + construct + " yet";
            case INVARIANT_VIOLATED -> construct + " must not appear in optimized MIR";
        };
    }
}
