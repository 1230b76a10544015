package com.phillippitts.tsaugment.exception;

/**
 * Thrown when per-sample pipelining is requested for a pipeline that contains a stage
 * which can only run as a whole-batch operation.
 */
public class PipelineCompatibilityException extends TsAugmentException {

    private final String stageName;

    public PipelineCompatibilityException(String stageName) {
        super("Augmenter '" + stageName + "' is not compatible with per-sample pipelining");
        this.stageName = stageName;
    }

    public String getStageName() {
        return stageName;
    }
}
