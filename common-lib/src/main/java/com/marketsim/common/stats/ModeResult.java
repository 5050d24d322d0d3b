package com.marketsim.common.stats;

/**
 * Mode of a value group: either a single most frequent value, or
 * {@link NoUniqueMode} when the highest frequency is shared.
 *
 * <p>Callers branch on {@link #isUnique()}; a shared mode is a normal outcome.
 */
public interface ModeResult {

    boolean isUnique();

    /** Human-readable form used by reports. */
    String describe();

    static ModeResult of(double value) {
        return new Value(value);
    }

    static ModeResult noUniqueMode() {
        return NoUniqueMode.INSTANCE;
    }

    record Value(double value) implements ModeResult {
        @Override
        public boolean isUnique() {
            return true;
        }

        @Override
        public String describe() {
            return String.valueOf(value);
        }
    }

    record NoUniqueMode() implements ModeResult {
        static final NoUniqueMode INSTANCE = new NoUniqueMode();

        @Override
        public boolean isUnique() {
            return false;
        }

        @Override
        public String describe() {
            return "No unique mode";
        }
    }
}
