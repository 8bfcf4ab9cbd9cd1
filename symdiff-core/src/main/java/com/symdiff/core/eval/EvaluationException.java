package com.symdiff.core.eval;

import com.symdiff.core.ErrorKind;
import com.symdiff.core.SymDiffException;

/**
 * 求值异常：变量未绑定、除以零、对数定义域错误
 */
public class EvaluationException extends SymDiffException {

    public EvaluationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind getKind() {
        return ErrorKind.EVALUATION;
    }
}
