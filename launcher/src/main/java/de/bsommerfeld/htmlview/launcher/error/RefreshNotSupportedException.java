package de.bsommerfeld.htmlview.launcher.error;

public class RefreshNotSupportedException extends ViewerException {

    public RefreshNotSupportedException(String message) {
        super(ViewerErrorKind.REFRESH_NOT_SUPPORTED, message);
    }
}
