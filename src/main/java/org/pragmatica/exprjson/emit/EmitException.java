package org.pragmatica.exprjson.emit;

/**
 * A value could not be written as JSON text.
 */
public final class EmitException extends RuntimeException {

    public EmitException(String message) {
        super(message);
    }

    public EmitException(String message, Throwable cause) {
        super(message, cause);
    }
}
