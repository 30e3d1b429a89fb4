package com.purchasingpower.workgraph.mutation;

import com.purchasingpower.workgraph.exception.GraphOperationException;
import com.purchasingpower.workgraph.storage.GraphStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
@RequiredArgsConstructor
public class MutationServiceImpl implements MutationService {

    private final GraphStore graphStore;
    private final WorkItemWriter writer;

    @Override
    public Map<String, Object> createNode(CreateNodeCommand command) {
        return graphStore.writeTransaction(tx -> writer.createNode(tx, command));
    }

    @Override
    public Map<String, Object> updateNode(String nodeId, NodeUpdate update) {
        if (nodeId == null || nodeId.isBlank()) {
            throw GraphOperationException.validation("node_id is required");
        }
        return graphStore.writeTransaction(tx -> writer.updateNode(tx, nodeId, update));
    }

    @Override
    public Map<String, Object> deleteNode(String nodeId) {
        return graphStore.writeTransaction(tx -> writer.deleteNode(tx, nodeId));
    }

    @Override
    public Map<String, Object> createEdge(EdgeCommand command) {
        return graphStore.writeTransaction(tx -> writer.createEdge(tx, command));
    }

    @Override
    public Map<String, Object> deleteEdge(EdgeCommand command) {
        return graphStore.writeTransaction(tx -> writer.deleteEdge(tx, command));
    }
}
