/**
 * Wire protocol between the calling process and the viewer process.
 *
 * <h2>Transport</h2>
 * Both sides communicate exclusively through JSON files inside a per-request
 * working area. No sockets, pipes or shared memory are involved:
 *
 * <pre>
 * config.json              caller  -> viewer   ViewerRequest (pretty-printed)
 * result.json              viewer  -> caller   ViewerExitStatus
 * commands.json            caller  -> viewer   ViewerCommand (overwritten per send)
 * command_responses.json   viewer  -> caller   ViewerCommandResponse (overwritten per send)
 * </pre>
 *
 * <h2>Compatibility</h2>
 * Every {@link de.bsommerfeld.htmlview.protocol.ViewerExitStatus} carries the
 * viewer's {@link de.bsommerfeld.htmlview.protocol.ProtocolVersion}. The
 * launcher rejects results from viewers whose version does not negotiate with
 * its own.
 *
 * <h2>Option blocks</h2>
 * {@link de.bsommerfeld.htmlview.protocol.WindowOptions},
 * {@link de.bsommerfeld.htmlview.protocol.BehaviourOptions},
 * {@link de.bsommerfeld.htmlview.protocol.EnvironmentOptions} and
 * {@link de.bsommerfeld.htmlview.protocol.DialogOptions} are interpreted only
 * by the viewer. The launcher passes them through unchanged.
 */
package de.bsommerfeld.htmlview.protocol;
