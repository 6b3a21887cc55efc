package com.pagecraft.service.tree;

import com.pagecraft.service.DesignerException;

/**
 * Rejected tree mutation. The tree is unchanged whenever one of these is thrown.
 */
public abstract class TreeOperationException extends DesignerException {

    protected TreeOperationException(String code, String message) {
        super(code, message);
    }
}
