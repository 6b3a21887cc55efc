package com.pagecraft.service.tree;

public class DepthExceededException extends TreeOperationException {

    public DepthExceededException(String message) {
        super("DEPTH_EXCEEDED", message);
    }
}
