package com.symdiff.core.ast;

import com.symdiff.core.ErrorKind;
import com.symdiff.core.SymDiffException;

/**
 * 节点标签不在求值/求导所支持的封闭集合内
 */
public class UnsupportedNodeException extends SymDiffException {

    public UnsupportedNodeException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.UNSUPPORTED;
    }
}
