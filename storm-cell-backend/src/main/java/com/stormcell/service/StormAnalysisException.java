package com.stormcell.service;

/**
 * Raised when a radar image cannot be obtained or is unusable for analysis.
 */
public class StormAnalysisException extends RuntimeException {

    private final boolean upstream;

    public StormAnalysisException(String message) {
        this(message, null, false);
    }

    public StormAnalysisException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public StormAnalysisException(String message, Throwable cause, boolean upstream) {
        super(message, cause);
        this.upstream = upstream;
    }

    public static StormAnalysisException upstream(String message, Throwable cause) {
        return new StormAnalysisException(message, cause, true);
    }

    /**
     * @return true if the failure lies with the remote image source rather than the image itself
     */
    public boolean isUpstream() {
        return upstream;
    }
}
