package io.plandigest.core.source;

import java.io.IOException;

public class RecordSourceException extends IOException {
    private final int httpStatus;

    public RecordSourceException(String message) {
        this(message, 0, null);
    }

    public RecordSourceException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public RecordSourceException(String message, int httpStatus) {
        this(message, httpStatus, null);
    }

    public RecordSourceException(String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }

    public boolean notFound() {
        return httpStatus == 404;
    }
}
