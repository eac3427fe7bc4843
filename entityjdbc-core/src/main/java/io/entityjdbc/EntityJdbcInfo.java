package io.entityjdbc;

/**
 * Provides library version metadata.
 */
public abstract class EntityJdbcInfo {
    private EntityJdbcInfo() {
    }

    public static final String NAME = "EntityJDBC";

    public static final String VERSION = "1.0.0";

    public static final String FULL_NAME = NAME + " " + VERSION;
}
