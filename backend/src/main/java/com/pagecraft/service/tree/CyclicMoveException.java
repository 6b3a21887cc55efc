package com.pagecraft.service.tree;

public class CyclicMoveException extends TreeOperationException {

    public CyclicMoveException(String message) {
        super("CYCLIC_MOVE", message);
    }
}
