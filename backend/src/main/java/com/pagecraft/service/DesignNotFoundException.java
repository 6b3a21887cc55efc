package com.pagecraft.service;

import java.util.UUID;

public class DesignNotFoundException extends DesignerException {

    public DesignNotFoundException(UUID designId) {
        super("DESIGN_NOT_FOUND", "Page design not found: " + designId);
    }
}
