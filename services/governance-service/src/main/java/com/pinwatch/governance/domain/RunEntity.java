package com.pinwatch.governance.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "runs", indexes = @Index(name = "idx_runs_repository", columnList = "repository"))
public class RunEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "delivery_id", nullable = false, unique = true, updatable = false)
    private String deliveryId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "event_type", nullable = false, updatable = false)
    private String eventType;

    @Column(name = "repository", nullable = false, updatable = false)
    private String repository;

    @Column(name = "branch", updatable = false)
    private String branch;

    @Column(name = "head_sha", updatable = false)
    private String headSha;

    @Column(name = "workflows_scanned", nullable = false, updatable = false)
    private int workflowsScanned;

    @Column(name = "findings_count", nullable = false, updatable = false)
    private int findingsCount;

    @Column(name = "failed_files", nullable = false, updatable = false)
    private int failedFiles;

    public static RunEntity of(NewRun run, int findingsCount, int failedFiles, Instant createdAt) {
        RunEntity entity = new RunEntity();
        entity.deliveryId = run.deliveryId();
        entity.eventType = run.eventType();
        entity.repository = run.repository();
        entity.branch = run.branch();
        entity.headSha = run.headSha();
        entity.workflowsScanned = run.workflowsScanned();
        entity.findingsCount = findingsCount;
        entity.failedFiles = failedFiles;
        entity.createdAt = createdAt;
        return entity;
    }

    public Long getId() {
        return id;
    }

    public String getDeliveryId() {
        return deliveryId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getEventType() {
        return eventType;
    }

    public String getRepository() {
        return repository;
    }

    public String getBranch() {
        return branch;
    }

    public String getHeadSha() {
        return headSha;
    }

    public int getWorkflowsScanned() {
        return workflowsScanned;
    }

    public int getFindingsCount() {
        return findingsCount;
    }

    public int getFailedFiles() {
        return failedFiles;
    }
}
