package de.bsommerfeld.htmlview.launcher;

/**
 * Whether {@link ViewerLauncher#launch(ViewerOptions)} waits for the viewer to exit.
 */
public enum ViewerWaitMode {

    /** Wait for exit and return {@link ViewerResult.Completed}. */
    BLOCKING,

    /** Return a {@link ViewerResult.Running} handle immediately. */
    NON_BLOCKING
}
