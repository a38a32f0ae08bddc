package de.bsommerfeld.htmlview.protocol;

import java.util.List;
import java.util.Objects;

/**
 * Navigation and security switches. Everything is off by default.
 */
public class BehaviourOptions {

    private boolean allowExternalNavigation = false;
    // only consulted when external navigation is allowed; null means any host
    private List<String> allowedDomains;
    private boolean enableDevtools = false;
    private boolean allowRemoteContent = false;
    private boolean allowNotifications = false;

    public boolean isAllowExternalNavigation() {
        return allowExternalNavigation;
    }

    public List<String> getAllowedDomains() {
        return allowedDomains;
    }

    public boolean isEnableDevtools() {
        return enableDevtools;
    }

    public boolean isAllowRemoteContent() {
        return allowRemoteContent;
    }

    public boolean isAllowNotifications() {
        return allowNotifications;
    }

    public void setAllowExternalNavigation(boolean allowExternalNavigation) {
        this.allowExternalNavigation = allowExternalNavigation;
    }

    public void setAllowedDomains(List<String> allowedDomains) {
        this.allowedDomains = allowedDomains == null ? null : List.copyOf(allowedDomains);
    }

    public void setEnableDevtools(boolean enableDevtools) {
        this.enableDevtools = enableDevtools;
    }

    public void setAllowRemoteContent(boolean allowRemoteContent) {
        this.allowRemoteContent = allowRemoteContent;
    }

    public void setAllowNotifications(boolean allowNotifications) {
        this.allowNotifications = allowNotifications;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BehaviourOptions that)) return false;
        return allowExternalNavigation == that.allowExternalNavigation
                && enableDevtools == that.enableDevtools
                && allowRemoteContent == that.allowRemoteContent
                && allowNotifications == that.allowNotifications
                && Objects.equals(allowedDomains, that.allowedDomains);
    }

    @Override
    public int hashCode() {
        return Objects.hash(allowExternalNavigation, allowedDomains, enableDevtools, allowRemoteContent,
                allowNotifications);
    }
}
