package de.bsommerfeld.htmlview.protocol;

/**
 * File names and command-line flags shared by both ends of the protocol.
 */
public final class ProtocolFiles {

    public static final String CONFIG_FILE = "config.json";
    public static final String RESULT_FILE = "result.json";
    public static final String COMMAND_FILE = "commands.json";
    public static final String COMMAND_RESPONSE_FILE = "command_responses.json";

    /** Prefix of the per-request working directory, followed by the request id. */
    public static final String WORKING_DIR_PREFIX = "html_view_";

    public static final String CONFIG_PATH_FLAG = "--config-path";
    public static final String RESULT_PATH_FLAG = "--result-path";

    private ProtocolFiles() {
    }
}
