package com.tilestream.world.gen;

/**
 * Fatal configuration error: empty class table, malformed range table, out of
 * range class index, invalid noise or scheduling parameters. Raised once while
 * building the classifier or scheduler; nothing starts in an invalid configuration.
 */
public class TerrainConfigException extends RuntimeException {

    public TerrainConfigException(String message) {
        super(message);
    }

    public TerrainConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
