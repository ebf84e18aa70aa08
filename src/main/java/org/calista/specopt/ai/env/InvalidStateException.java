package org.calista.specopt.ai.env;

import org.calista.specopt.ai.core.ErrorKind;
import org.calista.specopt.ai.core.SpecOptException;

public final class InvalidStateException extends SpecOptException {

    public InvalidStateException(String message) {
        super(ErrorKind.INVALID_STATE, message, null);
    }
}
