package org.finos.stitch.engine.server;

/**
 * A list request that cannot be served, with the HTTP status to report.
 */
public class ListRequestException extends RuntimeException {

    private final int status;

    public ListRequestException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }
}
