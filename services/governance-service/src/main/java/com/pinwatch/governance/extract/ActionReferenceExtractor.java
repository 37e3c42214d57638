package com.pinwatch.governance.extract;

import com.pinwatch.governance.domain.ActionReference;
import com.pinwatch.governance.domain.FindingEntity;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.SequenceNode;

/**
 * Finds {@code uses:} declarations in a workflow definition: the job-level {@code uses} of
 * reusable workflow calls and the {@code uses} of every step. Works on the YAML node graph so
 * that each reference keeps its source line.
 */
@Component
public class ActionReferenceExtractor {

    private static final String LOCAL_PREFIX = "./";
    private static final String DOCKER_PREFIX = "docker://";
    // line breaks as YAML counts them, so indexes match SnakeYAML marks
    private static final String LINE_BREAK = "\\r\\n|[\\n\\r\\u0085\\u2028\\u2029]";

    private final ActionClassifier classifier;

    public ActionReferenceExtractor(ActionClassifier classifier) {
        this.classifier = classifier;
    }

    public List<ActionReference> extract(String workflowPath, String content) {
        if (content == null || content.isBlank()) {
            return List.of();
        }
        if (workflowPath.length() > FindingEntity.WORKFLOW_PATH_LENGTH) {
            throw new WorkflowParseException("Workflow path exceeds " + FindingEntity.WORKFLOW_PATH_LENGTH + " characters");
        }
        Node root;
        try {
            root = new Yaml(new LoaderOptions()).compose(new StringReader(content));
        } catch (YAMLException ex) {
            throw new WorkflowParseException("Invalid YAML in " + workflowPath + ": " + ex.getMessage(), ex);
        }
        if (root == null) {
            return List.of();
        }
        if (!(root instanceof MappingNode document)) {
            throw new WorkflowParseException("Workflow root of " + workflowPath + " is not a mapping");
        }

        String[] lines = lines(content);
        List<ActionReference> references = new ArrayList<>();
        Optional<Node> jobs = valueOf(document, "jobs");
        if (jobs.isEmpty() || !(jobs.get() instanceof MappingNode jobsMapping)) {
            return references;
        }
        for (NodeTuple job : jobsMapping.getValue()) {
            if (!(job.getValueNode() instanceof MappingNode jobBody)) {
                continue;
            }
            collectUses(workflowPath, jobBody, lines, references);
            Optional<Node> steps = valueOf(jobBody, "steps");
            if (steps.isPresent() && steps.get() instanceof SequenceNode stepList) {
                for (Node step : stepList.getValue()) {
                    if (step instanceof MappingNode stepBody) {
                        collectUses(workflowPath, stepBody, lines, references);
                    }
                }
            }
        }
        return references;
    }

    private void collectUses(String workflowPath, MappingNode owner, String[] lines, List<ActionReference> out) {
        for (NodeTuple tuple : owner.getValue()) {
            if (!isKey(tuple, "uses") || !(tuple.getValueNode() instanceof ScalarNode value)) {
                continue;
            }
            int lineIndex = tuple.getKeyNode().getStartMark().getLine();
            toReference(workflowPath, value.getValue(), lineIndex, lines).ifPresent(out::add);
        }
    }

    Optional<ActionReference> toReference(String workflowPath, String uses, int lineIndex, String[] lines) {
        String value = uses == null ? "" : uses.trim();
        if (value.isEmpty() || value.startsWith(LOCAL_PREFIX) || value.startsWith(DOCKER_PREFIX)) {
            return Optional.empty();
        }
        int at = value.lastIndexOf('@');
        if (at <= 0 || at == value.length() - 1) {
            return Optional.empty();
        }
        String actionId = value.substring(0, at);
        String ref = value.substring(at + 1);
        if (actionId.indexOf('/') <= 0) {
            return Optional.empty();
        }
        if (actionId.length() > FindingEntity.ACTION_ID_LENGTH || ref.length() > FindingEntity.REF_LENGTH) {
            throw new WorkflowParseException("Action reference at line " + (lineIndex + 1) + " of " + workflowPath
                + " exceeds " + FindingEntity.ACTION_ID_LENGTH + " characters for the action or "
                + FindingEntity.REF_LENGTH + " for the ref");
        }
        String raw = lineIndex >= 0 && lineIndex < lines.length ? lines[lineIndex].trim() : "uses: " + value;
        if (raw.length() > FindingEntity.RAW_FRAGMENT_LENGTH) {
            raw = raw.substring(0, FindingEntity.RAW_FRAGMENT_LENGTH);
        }
        return Optional.of(new ActionReference(
            workflowPath,
            actionId,
            ref,
            classifier.isPinned(ref),
            classifier.isInternal(actionId),
            lineIndex + 1,
            raw
        ));
    }

    static String[] lines(String content) {
        return content.split(LINE_BREAK, -1);
    }

    private static Optional<Node> valueOf(MappingNode mapping, String key) {
        for (NodeTuple tuple : mapping.getValue()) {
            if (isKey(tuple, key)) {
                return Optional.of(tuple.getValueNode());
            }
        }
        return Optional.empty();
    }

    private static boolean isKey(NodeTuple tuple, String key) {
        return tuple.getKeyNode() instanceof ScalarNode scalar && key.equals(scalar.getValue());
    }
}
