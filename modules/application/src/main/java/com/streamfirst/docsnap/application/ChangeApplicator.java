package com.streamfirst.docsnap.application;

import com.streamfirst.docsnap.domain.Change;
import com.streamfirst.docsnap.domain.Document;
import com.streamfirst.docsnap.domain.ObjectOperation;

import java.util.List;

/**
 * Replays changes onto a document. Stateless; the only side effect is the mutation of the given
 * document. Failures of the document model (unknown node, duplicate create, ...) are not caught
 * here and leave the document in an undefined state, so callers must discard it.
 */
public class ChangeApplicator {

    /**
     * Applies each change in list order and, within a change, each operation in recorded order.
     *
     * @param document the instance to advance
     * @param changes changes in ascending version order
     */
    public void apply(Document document, List<Change> changes) {
        for (Change change : changes) {
            for (ObjectOperation op : change.getOps()) {
                apply(document, op);
            }
        }
    }

    void apply(Document document, ObjectOperation op) {
        switch (op.getType()) {
            case CREATE -> document.create(op.getNodeId(), op.getNodeType(), op.getProperties());
            case DELETE -> document.delete(op.getNodeId());
            case SET -> document.set(op.getNodeId(), op.getProperty(), op.getValue());
            case UPDATE -> document.updateText(op.getNodeId(), op.getProperty(), op.getEdit());
            default -> throw new IllegalArgumentException("Unsupported operation type " + op.getType());
        }
    }
}
