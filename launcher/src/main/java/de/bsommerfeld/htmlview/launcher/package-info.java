/**
 * Launches viewer processes and talks to them over the file protocol.
 *
 * <h2>Entry points</h2>
 * <ul>
 * <li>{@link de.bsommerfeld.htmlview.launcher.HtmlView} for one-liners,</li>
 * <li>{@link de.bsommerfeld.htmlview.launcher.ViewerLauncher} when wired
 * through {@link de.bsommerfeld.htmlview.launcher.config.HtmlViewModule}.</li>
 * </ul>
 *
 * <h2>Components</h2>
 * <pre>
 * ViewerLauncher      working area, config.json, spawn, blocking wait
 * ExitStatusReader    result.json with bounded backoff + version check
 * CommandChannel      commands.json / command_responses.json exchange
 * WorkingArea         single owner of the per-request directory
 * ViewerHandle        non-blocking control: wait, terminate, refresh
 * </pre>
 */
package de.bsommerfeld.htmlview.launcher;
