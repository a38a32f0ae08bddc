package de.bsommerfeld.htmlview.launcher.locate;

import de.bsommerfeld.htmlview.launcher.error.BinaryNotFoundException;

import java.nio.file.Path;

/**
 * Produces the path of the viewer executable, or fails.
 */
public interface AppLocator {

    Path locate() throws BinaryNotFoundException;
}
