package io.clgrader.core.assessment;

/// Expectation on the exit status of a completed process.
///
/// ### Permitted Subtypes
/// - {@link Exact} - a single status
/// - {@link Between} - an inclusive range
public sealed interface StatusPredicate {

    boolean test(int status);

    String describe();

    static StatusPredicate exact(int status) {
        return new Exact(status);
    }

    static StatusPredicate between(int min, int max) {
        return new Between(min, max);
    }

    record Exact(int status) implements StatusPredicate {

        @Override
        public boolean test(int actual) {
            return actual == status;
        }

        @Override
        public String describe() {
            return Integer.toString(status);
        }
    }

    record Between(int min, int max) implements StatusPredicate {

        public Between {
            if (min > max) {
                throw new IllegalArgumentException("Min must be less than or equal to max");
            }
        }

        @Override
        public boolean test(int actual) {
            return (min <= actual) && (actual <= max);
        }

        @Override
        public String describe() {
            return "between " + min + " and " + max;
        }
    }
}
