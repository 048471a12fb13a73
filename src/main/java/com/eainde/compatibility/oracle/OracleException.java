package com.eainde.compatibility.oracle;

/**
 * The oracle could not produce a reply (transport error, model error, empty content).
 */
public class OracleException extends RuntimeException {

    public OracleException(String message) {
        super(message);
    }

    public OracleException(String message, Throwable cause) {
        super(message, cause);
    }
}
