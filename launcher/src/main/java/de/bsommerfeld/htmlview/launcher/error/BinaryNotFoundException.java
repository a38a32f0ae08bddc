package de.bsommerfeld.htmlview.launcher.error;

import java.nio.file.Path;
import java.util.List;

/**
 * No viewer executable could be located.
 */
public class BinaryNotFoundException extends ViewerException {

    private final List<Path> searched;

    public BinaryNotFoundException(String message, List<Path> searched) {
        super(ViewerErrorKind.BINARY_NOT_FOUND, message);
        this.searched = List.copyOf(searched);
    }

    /** Candidate locations that were checked, in search order. */
    public List<Path> searched() {
        return searched;
    }
}
