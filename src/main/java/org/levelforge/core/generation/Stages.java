package org.levelforge.core.generation;

import java.util.function.Supplier;

/**
 * Runs one named step and reports it to a listener. Exceptions thrown by the step are
 * passed through untouched; the listener still sees the stage end.
 */
public final class Stages {

    private Stages() {}

    public static <T> T call(StageListener listener, StageId id, String name, Supplier<T> step) {
        long start = System.currentTimeMillis();
        listener.onStageStart(id, name);
        try {
            return step.get();
        } finally {
            listener.onStageEnd(id, name, System.currentTimeMillis() - start);
        }
    }

}
