package com.pagecraft.domain;

import jakarta.persistence.*;

import java.time.OffsetDateTime;
import java.util.UUID;

/** A page under design. The component tree is stored as one JSON document. */
@Entity
@Table(name = "page_designs")
public class PageDesign {

    @Id
    @GeneratedValue(strategy = GenerationType.AUTO)
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "root_id", nullable = false)
    private String rootId;

    @Column(name = "tree_json", nullable = false, length = 1048576)
    private String treeJson;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    public PageDesign() {}

    public PageDesign(String name, String ownerId) {
        this.name = name;
        this.ownerId = ownerId;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = OffsetDateTime.now();
    }

    // Getters
    public UUID getId() { return id; }
    public String getName() { return name; }
    public String getOwnerId() { return ownerId; }
    public String getRootId() { return rootId; }
    public String getTreeJson() { return treeJson; }
    public Long getVersion() { return version; }
    public OffsetDateTime getCreatedAt() { return createdAt; }
    public OffsetDateTime getUpdatedAt() { return updatedAt; }

    // Setters
    public void setId(UUID id) { this.id = id; }
    public void setName(String name) { this.name = name; }
    public void setOwnerId(String ownerId) { this.ownerId = ownerId; }
    public void setRootId(String rootId) { this.rootId = rootId; }
    public void setTreeJson(String treeJson) { this.treeJson = treeJson; }
    public void setVersion(Long version) { this.version = version; }
    public void setCreatedAt(OffsetDateTime t) { this.createdAt = t; }
    public void setUpdatedAt(OffsetDateTime t) { this.updatedAt = t; }
}
