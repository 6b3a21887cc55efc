package com.pagecraft.service.tree;

public class ChildLimitExceededException extends TreeOperationException {

    public ChildLimitExceededException(String message) {
        super("CHILD_LIMIT_EXCEEDED", message);
    }
}
