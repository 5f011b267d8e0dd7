package com.relayflow.relayflow_engine.engine;

import com.relayflow.relayflow_engine.exception.ConfigValidationException;
import com.relayflow.relayflow_engine.exception.UnresolvedReferenceException;
import com.relayflow.relayflow_engine.exception.ValidationException;
import com.relayflow.relayflow_engine.executor.NodeExecutor;
import com.relayflow.relayflow_engine.executor.NodeExecutorRegistry;
import com.relayflow.relayflow_engine.executor.Reference;
import com.relayflow.relayflow_engine.executor.TemplateRenderer;
import com.relayflow.relayflow_engine.executor.VariableResolver;
import com.relayflow.relayflow_engine.model.domain.NodeDefinition;
import com.relayflow.relayflow_engine.model.domain.WorkflowDefinition;
import com.relayflow.relayflow_engine.model.run.ExecutionContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import java.util.Set;

/**
 * Static checks run before a run reaches RUNNING, in this order:
 * <ol>
 *   <li>unique node ids, edge endpoints declared, reserved id not used</li>
 *   <li>graph is acyclic</li>
 *   <li>every node type is registered</li>
 *   <li>entry-point nodes have no incoming edges</li>
 *   <li>config matches the executor's schema; config placeholders name declared inputs</li>
 *   <li>every input reference points to a strict ancestor</li>
 * </ol>
 * The first violation is thrown.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkflowValidator {

    private static final Set<String> NODE_DOCUMENT_FIELDS = Set.of("output", "attempts");
    private static final Set<String> TRIGGER_DOCUMENT_FIELDS = Set.of("type", "triggerId", "payload", "firedAt", "scheduledAt");

    private final NodeExecutorRegistry registry;
    private final VariableResolver resolver;
    private final TemplateRenderer renderer;

    public WorkflowGraph validate(WorkflowDefinition definition) {
        WorkflowGraph graph = WorkflowGraph.of(definition);
        for (NodeDefinition node : definition.getNodes()) {
            if (ExecutionContext.TRIGGER_NAMESPACE.equals(node.getId())) {
                throw new ValidationException("Node id '" + node.getId() + "' is reserved");
            }
        }

        graph.requireAcyclic();

        NodeExecutor[] executors = new NodeExecutor[graph.size()];
        for (int i = 0; i < graph.size(); i++) {
            executors[i] = registry.resolve(graph.node(i).getType());
        }

        for (int i = 0; i < graph.size(); i++) {
            if (executors[i].isEntryPoint() && graph.parents(i).length > 0) {
                throw new ValidationException("Trigger node '" + graph.node(i).getId()
                        + "' (" + graph.node(i).getType() + ") cannot have incoming edges");
            }
        }

        for (int i = 0; i < graph.size(); i++) {
            checkConfig(graph.node(i), executors[i]);
        }

        for (int i = 0; i < graph.size(); i++) {
            checkReferences(graph, i);
        }

        log.debug("Workflow {} validated: {} nodes, {} edges",
                definition.getId(), graph.size(), definition.getEdges().size());
        return graph;
    }

    private void checkConfig(NodeDefinition node, NodeExecutor executor) {
        List<String> violations = new ArrayList<>();
        executor.validateConfig(node.getConfig()).forEach(v -> violations.add(node.getId() + ": " + v));

        Set<String> declaredInputs = node.getInputs().keySet();
        for (String name : renderer.placeholderNames(node.getConfig())) {
            if (!declaredInputs.contains(name)) {
                violations.add(node.getId() + ": config placeholder {{" + name + "}} does not name a declared input");
            }
        }
        if (!violations.isEmpty()) {
            throw new ConfigValidationException(violations);
        }
    }

    private void checkReferences(WorkflowGraph graph, int index) {
        NodeDefinition node = graph.node(index);
        BitSet ancestors = graph.ancestors(index);
        for (Reference ref : resolver.extractReferences(node.getInputs())) {
            String root = ref.root();
            if (ExecutionContext.TRIGGER_NAMESPACE.equals(root)) {
                requireField(ref, TRIGGER_DOCUMENT_FIELDS);
                continue;
            }
            if (root.equals(node.getId())) {
                throw new UnresolvedReferenceException(ref.raw(), "node '" + node.getId() + "' references itself");
            }
            int target = graph.indexOf(root);
            if (target < 0) {
                throw new UnresolvedReferenceException(ref.raw(), "node '" + root + "' is not declared");
            }
            if (!ancestors.get(target)) {
                throw new UnresolvedReferenceException(ref.raw(),
                        "node '" + root + "' is not an upstream ancestor of '" + node.getId() + "'");
            }
            requireField(ref, NODE_DOCUMENT_FIELDS);
        }
    }

    private static void requireField(Reference ref, Set<String> allowed) {
        if (ref.path().isEmpty()) return;
        String first = firstSegment(ref.path());
        if (!allowed.contains(first)) {
            throw new UnresolvedReferenceException(ref.raw(), "'" + first + "' is not one of " + allowed);
        }
    }

    private static String firstSegment(String path) {
        int cut = path.length();
        for (char c : new char[]{'.', '['}) {
            int i = path.indexOf(c);
            if (i >= 0 && i < cut) cut = i;
        }
        return path.substring(0, cut).trim();
    }
}
