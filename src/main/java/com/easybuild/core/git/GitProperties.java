package com.easybuild.core.git;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "easybuild.git")
public class GitProperties {

    private String executable = "git";
    private String authorName = "";
    private String authorEmail = "";
    private Timeouts timeouts = new Timeouts();

    public String getExecutable() { return executable; }
    public void setExecutable(String executable) { this.executable = executable; }
    public String getAuthorName() { return authorName; }
    public void setAuthorName(String authorName) { this.authorName = authorName; }
    public String getAuthorEmail() { return authorEmail; }
    public void setAuthorEmail(String authorEmail) { this.authorEmail = authorEmail; }
    public Timeouts getTimeouts() { return timeouts; }
    public void setTimeouts(Timeouts timeouts) { this.timeouts = timeouts; }

    /**
     * Returns true when both parts of the committer identity are configured.
     * Without it, commits use whatever identity the host's git configuration provides.
     */
    public boolean hasIdentity() {
        return authorName != null && !authorName.isBlank()
                && authorEmail != null && !authorEmail.isBlank();
    }

    /**
     * Per-operation timeouts in seconds.
     */
    public static class Timeouts {
        private int cloneSeconds = 300;
        private int checkoutSeconds = 30;
        private int pullSeconds = 120;
        private int mergeSeconds = 60;
        private int stageSeconds = 30;
        private int commitSeconds = 30;
        private int pushSeconds = 120;
        private int logSeconds = 10;

        public Duration cloneTimeout() { return Duration.ofSeconds(cloneSeconds); }
        public Duration checkoutTimeout() { return Duration.ofSeconds(checkoutSeconds); }
        public Duration pullTimeout() { return Duration.ofSeconds(pullSeconds); }
        public Duration mergeTimeout() { return Duration.ofSeconds(mergeSeconds); }
        public Duration stageTimeout() { return Duration.ofSeconds(stageSeconds); }
        public Duration commitTimeout() { return Duration.ofSeconds(commitSeconds); }
        public Duration pushTimeout() { return Duration.ofSeconds(pushSeconds); }
        public Duration logTimeout() { return Duration.ofSeconds(logSeconds); }

        public int getCloneSeconds() { return cloneSeconds; }
        public void setCloneSeconds(int cloneSeconds) { this.cloneSeconds = cloneSeconds; }
        public int getCheckoutSeconds() { return checkoutSeconds; }
        public void setCheckoutSeconds(int checkoutSeconds) { this.checkoutSeconds = checkoutSeconds; }
        public int getPullSeconds() { return pullSeconds; }
        public void setPullSeconds(int pullSeconds) { this.pullSeconds = pullSeconds; }
        public int getMergeSeconds() { return mergeSeconds; }
        public void setMergeSeconds(int mergeSeconds) { this.mergeSeconds = mergeSeconds; }
        public int getStageSeconds() { return stageSeconds; }
        public void setStageSeconds(int stageSeconds) { this.stageSeconds = stageSeconds; }
        public int getCommitSeconds() { return commitSeconds; }
        public void setCommitSeconds(int commitSeconds) { this.commitSeconds = commitSeconds; }
        public int getPushSeconds() { return pushSeconds; }
        public void setPushSeconds(int pushSeconds) { this.pushSeconds = pushSeconds; }
        public int getLogSeconds() { return logSeconds; }
        public void setLogSeconds(int logSeconds) { this.logSeconds = logSeconds; }
    }
}
