package com.terralint.core.oracle;

/**
 * Thrown when an oracle cannot produce a verdict, for example because its release data is
 * unavailable.
 */
public class OracleException extends Exception {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
