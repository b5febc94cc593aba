package com.liquidity.backend.exception;

public class PipelineAlreadyRunningException extends RuntimeException {
    public PipelineAlreadyRunningException() {
        super("Pipeline is already executing");
    }
}
