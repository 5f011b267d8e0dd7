package com.relayflow.relayflow_engine.service;

import com.relayflow.relayflow_engine.engine.RunStateRecorder;
import com.relayflow.relayflow_engine.engine.WorkflowValidator;
import com.relayflow.relayflow_engine.model.domain.WorkflowDefinition;
import com.relayflow.relayflow_engine.trigger.TriggerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Deploys workflow definitions: validates, stores and registers their trigger nodes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DefinitionService {

    private final WorkflowValidator validator;
    private final RunStateRecorder recorder;
    private final TriggerService triggerService;

    /**
     * @throws com.relayflow.relayflow_engine.exception.ValidationException when the definition is invalid;
     *         nothing is stored in that case
     */
    public void deploy(WorkflowDefinition definition) {
        validator.validate(definition);
        recorder.saveDefinition(definition);
        triggerService.registerDefinition(definition);
        log.info("Workflow {} deployed ({} nodes, concurrency={}, failure={})", definition.getId(),
                definition.getNodes().size(), definition.getConcurrencyPolicy(), definition.getFailurePolicy());
    }

    public boolean undeploy(String definitionId) {
        triggerService.unregisterDefinition(definitionId);
        boolean removed = recorder.deleteDefinition(definitionId);
        log.info("Workflow {} undeployed (found={})", definitionId, removed);
        return removed;
    }
}
