package com.flagship.tax_submission.transmission;

/**
 * One attempt at talking to the authority. Attempts are numbered from 1.
 */
@FunctionalInterface
public interface TransmissionOperation<T> {

    T execute(int attempt) throws Exception;
}
