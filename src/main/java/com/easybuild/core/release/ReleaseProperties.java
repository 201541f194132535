package com.easybuild.core.release;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "easybuild.release")
public class ReleaseProperties {

    private String incrementType = "patch";
    private String commitMessagePrefix = "#Release ";
    private int changelogSize = 5;
    private int notifyTimeoutSeconds = 10;

    public String getIncrementType() { return incrementType; }
    public void setIncrementType(String incrementType) { this.incrementType = incrementType; }
    public String getCommitMessagePrefix() { return commitMessagePrefix; }
    public void setCommitMessagePrefix(String commitMessagePrefix) { this.commitMessagePrefix = commitMessagePrefix; }
    public int getChangelogSize() { return changelogSize; }
    public void setChangelogSize(int changelogSize) { this.changelogSize = changelogSize; }
    public int getNotifyTimeoutSeconds() { return notifyTimeoutSeconds; }
    public void setNotifyTimeoutSeconds(int notifyTimeoutSeconds) { this.notifyTimeoutSeconds = notifyTimeoutSeconds; }
}
