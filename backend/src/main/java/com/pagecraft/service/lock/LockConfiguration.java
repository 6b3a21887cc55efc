package com.pagecraft.service.lock;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties("designer.locks")
public class LockConfiguration {

    private int maxDurationMinutes = 480;
    private int maxExtensionMinutes = 120;
    private int autoRenewThresholdMinutes = 5;
    private int reasonMaxLength = 200;
    private String store = "jpa";
    private Duration cleanupInterval = Duration.ofSeconds(60);

    public int getMaxDurationMinutes() { return maxDurationMinutes; }
    public void setMaxDurationMinutes(int maxDurationMinutes) { this.maxDurationMinutes = maxDurationMinutes; }

    public int getMaxExtensionMinutes() { return maxExtensionMinutes; }
    public void setMaxExtensionMinutes(int maxExtensionMinutes) { this.maxExtensionMinutes = maxExtensionMinutes; }

    /** Remaining time below which a holder is expected to extend. */
    public int getAutoRenewThresholdMinutes() { return autoRenewThresholdMinutes; }
    public void setAutoRenewThresholdMinutes(int minutes) { this.autoRenewThresholdMinutes = minutes; }

    public int getReasonMaxLength() { return reasonMaxLength; }
    public void setReasonMaxLength(int reasonMaxLength) { this.reasonMaxLength = reasonMaxLength; }

    /** {@code jpa} or {@code memory}. */
    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }

    public Duration getCleanupInterval() { return cleanupInterval; }
    public void setCleanupInterval(Duration cleanupInterval) { this.cleanupInterval = cleanupInterval; }
}
