package com.pagecraft.domain;

import jakarta.annotation.Nullable;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * Stored lock record. The resource id is the primary key, so the table itself
 * refuses a second row for the same resource.
 */
@Entity
@Table(name = "resource_locks")
public class ResourceLockEntity {

    @Id
    @Column(name = "resource_id", nullable = false, length = 255)
    private String resourceId;

    @Column(name = "holder_id", nullable = false)
    private String holderId;

    @Column(name = "token", nullable = false, unique = true, length = 64)
    private String token;

    @Column(name = "lock_type", nullable = false, length = 32)
    private String lockType;

    @Column(name = "acquired_at", nullable = false)
    private Instant acquiredAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Nullable
    @Column(name = "reason", length = 200)
    private String reason;

    public ResourceLockEntity() {}

    // ── Getters and setters ────────────────────────────────────────────────

    public String getResourceId() { return resourceId; }
    public void setResourceId(String resourceId) { this.resourceId = resourceId; }

    public String getHolderId() { return holderId; }
    public void setHolderId(String holderId) { this.holderId = holderId; }

    public String getToken() { return token; }
    public void setToken(String token) { this.token = token; }

    public String getLockType() { return lockType; }
    public void setLockType(String lockType) { this.lockType = lockType; }

    public Instant getAcquiredAt() { return acquiredAt; }
    public void setAcquiredAt(Instant acquiredAt) { this.acquiredAt = acquiredAt; }

    public Instant getExpiresAt() { return expiresAt; }
    public void setExpiresAt(Instant expiresAt) { this.expiresAt = expiresAt; }

    @Nullable
    public String getReason() { return reason; }
    public void setReason(@Nullable String reason) { this.reason = reason; }
}
