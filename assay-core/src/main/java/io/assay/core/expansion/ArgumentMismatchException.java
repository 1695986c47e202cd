package io.assay.core.expansion;

import java.io.Serial;

/// Thrown when a data row cannot be bound to the parameters of a test body.
public class ArgumentMismatchException extends Exception {

    @Serial private static final long serialVersionUID = -6044193725816623957L;

    public ArgumentMismatchException(String message) {
        super(message);
    }
}
