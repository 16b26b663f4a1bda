package com.yearlylikes.processor;

/**
 * A task run once against the user's Spotify account.
 *
 * @param <R> the report produced by a completed run
 */
public interface Processor<R> {

    R run(RunContext context) throws ProcessorException;
}
