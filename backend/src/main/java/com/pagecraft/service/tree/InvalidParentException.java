package com.pagecraft.service.tree;

public class InvalidParentException extends TreeOperationException {

    public InvalidParentException(String message) {
        super("INVALID_PARENT", message);
    }
}
