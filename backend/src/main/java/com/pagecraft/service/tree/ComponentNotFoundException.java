package com.pagecraft.service.tree;

public class ComponentNotFoundException extends TreeOperationException {

    public ComponentNotFoundException(String componentId) {
        super("COMPONENT_NOT_FOUND", "Component not found: " + componentId);
    }
}
