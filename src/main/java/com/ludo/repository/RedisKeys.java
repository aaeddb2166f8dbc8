package com.ludo.repository;

/**
 * Redis key layout. All key names are built here.
 */
public final class RedisKeys {

    private static final String PFX = "ludo:";

    private RedisKeys() {}

    /** Serialized game aggregate, expires when idle. */
    public static String game(String gameId) {
        return PFX + "game:" + gameId;
    }

    /** Game id a connected session belongs to. */
    public static String session(String sessionId) {
        return PFX + "session:" + sessionId;
    }
}
