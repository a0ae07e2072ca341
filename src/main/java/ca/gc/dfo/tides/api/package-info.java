/**
 * <strong>Purpose:</strong> Command-line adapters for the {@code tides} toolkit.
 * <p><strong>Pipeline role:</strong> Parses {@code key=value} arguments and flags, merges configuration, validates
 * it and hands off to the application use cases through {@link ca.gc.dfo.tides.config.CompositionRoot}.
 * <p><strong>Concurrency:</strong> Single-threaded; one command per process.
 * <p><strong>Exit codes:</strong> See {@link ca.gc.dfo.tides.api.ExitCode}.
 *
 * @since 0.1.0
 */
package ca.gc.dfo.tides.api;
