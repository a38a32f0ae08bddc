package de.bsommerfeld.htmlview.launcher.error;

/**
 * A protocol value could not be turned into JSON. Indicates a programming
 * defect rather than an environmental problem.
 */
public class ProtocolSerializationException extends ViewerException {

    public ProtocolSerializationException(String message, Throwable cause) {
        super(ViewerErrorKind.SERIALIZATION, message, cause);
    }
}
