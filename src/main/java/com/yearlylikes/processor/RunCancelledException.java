package com.yearlylikes.processor;

/**
 * Thrown at a checkpoint once the run was cancelled or ran past its deadline.
 */
public class RunCancelledException extends ProcessorException {

    public RunCancelledException(String message) {
        super(message);
    }
}
