package com.example.musicstreaming.common.util;

/**
 * Pause between poll iterations. Injected so tests can advance virtual time instead of sleeping.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
