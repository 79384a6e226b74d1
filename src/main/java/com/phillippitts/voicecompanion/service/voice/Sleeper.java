package com.phillippitts.voicecompanion.service.voice;

/**
 * Blocking sleep, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
