package de.bsommerfeld.htmlview.protocol;

import java.util.Objects;

public class DialogOptions {

    private boolean allowFileDialogs = false;
    private boolean allowMessageDialogs = false;

    public boolean isAllowFileDialogs() {
        return allowFileDialogs;
    }

    public boolean isAllowMessageDialogs() {
        return allowMessageDialogs;
    }

    public void setAllowFileDialogs(boolean allowFileDialogs) {
        this.allowFileDialogs = allowFileDialogs;
    }

    public void setAllowMessageDialogs(boolean allowMessageDialogs) {
        this.allowMessageDialogs = allowMessageDialogs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DialogOptions that)) return false;
        return allowFileDialogs == that.allowFileDialogs && allowMessageDialogs == that.allowMessageDialogs;
    }

    @Override
    public int hashCode() {
        return Objects.hash(allowFileDialogs, allowMessageDialogs);
    }
}
