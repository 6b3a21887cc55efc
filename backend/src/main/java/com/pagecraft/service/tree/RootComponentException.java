package com.pagecraft.service.tree;

public class RootComponentException extends TreeOperationException {

    public RootComponentException(String message) {
        super("ROOT_COMPONENT", message);
    }
}
