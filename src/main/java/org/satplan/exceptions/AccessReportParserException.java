package org.satplan.exceptions;

public class AccessReportParserException extends RuntimeException {
    public AccessReportParserException(String message) {
        super(message);
    }

    public AccessReportParserException(String message, Throwable cause) {
        super(message, cause);
    }
}
