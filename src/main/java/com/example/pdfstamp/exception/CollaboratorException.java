package com.example.pdfstamp.exception;

import com.example.pdfstamp.splice.SpliceStep;
import lombok.Getter;

/**
 * 页面拼接流程中某一步外部调用失败
 */
@Getter
public class CollaboratorException extends StampException {

    private final SpliceStep step;

    public CollaboratorException(SpliceStep step, Throwable cause) {
        super("页面拼接失败，步骤: " + step.getDescription() + " - " + cause.getMessage(), cause);
        this.step = step;
    }
}
