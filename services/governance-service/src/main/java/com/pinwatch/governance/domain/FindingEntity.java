package com.pinwatch.governance.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;

@Entity
@Table(name = "findings", indexes = {
    @Index(name = "idx_findings_run_id", columnList = "run_id"),
    @Index(name = "idx_findings_action_id", columnList = "action_id")
})
public class FindingEntity {

    public static final int WORKFLOW_PATH_LENGTH = 1024;
    public static final int ACTION_ID_LENGTH = 512;
    public static final int REF_LENGTH = 512;
    public static final int RAW_FRAGMENT_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "run_id", nullable = false, updatable = false)
    private Long runId;

    @Column(name = "workflow_path", nullable = false, length = WORKFLOW_PATH_LENGTH, updatable = false)
    private String workflowPath;

    @Column(name = "action_id", nullable = false, length = ACTION_ID_LENGTH, updatable = false)
    private String actionId;

    @Column(name = "ref", nullable = false, length = REF_LENGTH, updatable = false)
    private String ref;

    @Column(name = "pinned", nullable = false, updatable = false)
    private boolean pinned;

    @Column(name = "internal", nullable = false, updatable = false)
    private boolean internal;

    @Column(name = "line_number", updatable = false)
    private Integer lineNumber;

    @Column(name = "raw_fragment", length = RAW_FRAGMENT_LENGTH, updatable = false)
    private String rawFragment;

    public static FindingEntity of(Long runId, ActionReference reference) {
        FindingEntity entity = new FindingEntity();
        entity.runId = runId;
        entity.workflowPath = reference.workflowPath();
        entity.actionId = reference.actionId();
        entity.ref = reference.ref();
        entity.pinned = reference.pinned();
        entity.internal = reference.internal();
        entity.lineNumber = reference.lineNumber();
        entity.rawFragment = reference.rawFragment();
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

    public String getActionId() {
        return actionId;
    }

    public String getRef() {
        return ref;
    }

    public boolean isPinned() {
        return pinned;
    }

    public boolean isInternal() {
        return internal;
    }

    public Integer getLineNumber() {
        return lineNumber;
    }

    public String getRawFragment() {
        return rawFragment;
    }
}
