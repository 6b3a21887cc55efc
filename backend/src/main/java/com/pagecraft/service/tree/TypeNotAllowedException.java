package com.pagecraft.service.tree;

public class TypeNotAllowedException extends TreeOperationException {

    public TypeNotAllowedException(String message) {
        super("TYPE_NOT_ALLOWED", message);
    }
}
