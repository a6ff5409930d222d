package com.ryuqq.runnertype.core.spi;

/**
 * Signals that no record with the requested name exists.
 *
 * <p>This is an expected answer of {@link RunnerTypeStore#findByName(String)} rather than
 * a store failure, so it does not extend {@link StoreException}.</p>
 *
 * @author Runner Type Registry Team
 * @since 1.0.0
 */
public class RunnerTypeNotFoundException extends RuntimeException {

    private final String name;

    public RunnerTypeNotFoundException(String name) {
        super("Runner type not found: " + name);
        this.name = name;
    }

    /**
     * Returns the name that was looked up.
     *
     * @return the runner type name
     */
    public String getName() {
        return name;
    }
}
