package com.bayesenum.server.ai;

/**
 * A structure or CPT file line could not be parsed. Loading aborts on the first
 * one; no partially loaded network is returned.
 */
public class NetworkFormatException extends BayesNetworkException {
    private final String reason;
    private final int lineNumber;
    private final String line;

    public NetworkFormatException(String message, int lineNumber, String line) {
        super(message + " (line " + lineNumber + ": '" + line + "')");
        this.reason = message;
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /** The message without the offending line's text. */
    public String getReason() {
        return reason;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}
