package com.flagship.tax_submission.transmission;

/**
 * Blocking wait between transmission attempts.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(long millis) throws InterruptedException;
}
