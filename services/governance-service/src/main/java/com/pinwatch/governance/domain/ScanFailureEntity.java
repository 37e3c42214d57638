package com.pinwatch.governance.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "scan_failures")
public class ScanFailureEntity {

    public static final int WORKFLOW_PATH_LENGTH = 1024;
    public static final int REASON_LENGTH = 400;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "run_id", nullable = false, updatable = false)
    private Long runId;

    @Column(name = "workflow_path", length = WORKFLOW_PATH_LENGTH, updatable = false)
    private String workflowPath;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_code", nullable = false, updatable = false)
    private ScanFailureCode failureCode;

    @Column(name = "failure_reason", nullable = false, length = REASON_LENGTH, updatable = false)
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public static ScanFailureEntity of(Long runId, ScanFailure failure, Instant createdAt) {
        ScanFailureEntity entity = new ScanFailureEntity();
        entity.runId = runId;
        entity.workflowPath = failure.path();
        entity.failureCode = failure.code();
        entity.failureReason = failure.reason();
        entity.createdAt = createdAt;
        return entity;
    }

    public Long getId() {
        return id;
    }

    public Long getRunId() {
        return runId;
    }

    public String getWorkflowPath() {
        return workflowPath;
    }

    public ScanFailureCode getFailureCode() {
        return failureCode;
    }

    public String getFailureReason() {
        return failureReason;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
