package de.bsommerfeld.htmlview.protocol;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Runtime environment of the viewer.
 *
 * <p>
 * When {@code timeoutSeconds} is set the viewer closes itself after that many
 * seconds and reports {@code timed_out}.
 */
public class EnvironmentOptions {

    private Path workingDir;
    private Long timeoutSeconds;

    public Path getWorkingDir() {
        return workingDir;
    }

    public Long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setWorkingDir(Path workingDir) {
        this.workingDir = workingDir;
    }

    public void setTimeoutSeconds(Long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EnvironmentOptions that)) return false;
        return Objects.equals(workingDir, that.workingDir) && Objects.equals(timeoutSeconds, that.timeoutSeconds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workingDir, timeoutSeconds);
    }
}
