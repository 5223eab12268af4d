package io.clgrader.core.assessment;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/// Argument vectors a test case is invoked with.
///
/// Most cases have a single vector. A case may instead list several vectors, or ask for
/// every ordering of a set of arguments; the engine then runs one invocation per vector and
/// combines the results according to {@link #getMode()}.
///
/// @implNote **Immutable**.
public final class ArgumentSpec {

    /// Upper bound on the arguments accepted by {@link #permutationsOf}; 8! is 40320 runs.
    public static final int MAX_PERMUTED_ARGUMENTS = 8;

    private static final ArgumentSpec EMPTY = new ArgumentSpec(List.of(List.of()), PermutationMode.ALL_OF);

    private final List<List<String>> variants;
    private final PermutationMode mode;

    private ArgumentSpec(List<List<String>> variants, PermutationMode mode) {
        if (variants.isEmpty()) {
            throw new IllegalArgumentException("At least one argument vector is required");
        }
        this.variants = variants.stream().map(List::copyOf).toList();
        this.mode = Objects.requireNonNull(mode, "mode must not be null");
    }

    public static ArgumentSpec none() {
        return EMPTY;
    }

    public static ArgumentSpec single(List<String> arguments) {
        return new ArgumentSpec(List.of(arguments), PermutationMode.ALL_OF);
    }

    public static ArgumentSpec variants(List<List<String>> variants, PermutationMode mode) {
        return new ArgumentSpec(variants, mode);
    }

    /// Expands every distinct ordering of `arguments`.
    ///
    /// Orderings are listed in lexicographic order of argument positions, with duplicate
    /// vectors (from repeated arguments) collapsed.
    ///
    /// @param arguments arguments to permute, at most {@link #MAX_PERMUTED_ARGUMENTS}
    /// @param mode how permutation results combine, not null
    /// @return the expanded spec, never null
    /// @throws IllegalArgumentException if too many arguments are given
    public static ArgumentSpec permutationsOf(List<String> arguments, PermutationMode mode) {
        if (arguments.size() > MAX_PERMUTED_ARGUMENTS) {
            throw new IllegalArgumentException(
                    "Cannot permute more than "
                            + MAX_PERMUTED_ARGUMENTS
                            + " arguments, got "
                            + arguments.size());
        }
        Set<List<String>> orderings = new LinkedHashSet<>();
        permute(new ArrayList<>(arguments), new ArrayList<>(), new boolean[arguments.size()], orderings);
        return new ArgumentSpec(new ArrayList<>(orderings), mode);
    }

    private static void permute(
            List<String> source, List<String> current, boolean[] used, Set<List<String>> out) {
        if (current.size() == source.size()) {
            out.add(List.copyOf(current));
            return;
        }
        for (int i = 0; i < source.size(); i++) {
            if (used[i]) {
                continue;
            }
            used[i] = true;
            current.add(source.get(i));
            permute(source, current, used, out);
            current.remove(current.size() - 1);
            used[i] = false;
        }
    }

    public List<List<String>> getVariants() {
        return variants;
    }

    public PermutationMode getMode() {
        return mode;
    }

    public boolean isSingle() {
        return variants.size() == 1;
    }

    /// Combines per-variant pass flags according to the permutation mode.
    ///
    /// @param passed pass flag of each variant, in variant order, not null
    /// @return whether the case as a whole passed
    public boolean combine(List<Boolean> passed) {
        if (mode == PermutationMode.ANY_OF) {
            return passed.contains(Boolean.TRUE);
        }
        return !passed.contains(Boolean.FALSE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ArgumentSpec other)) {
            return false;
        }
        return variants.equals(other.variants) && mode == other.mode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(variants, mode);
    }

    @Override
    public String toString() {
        return isSingle() ? variants.get(0).toString() : mode + variants.toString();
    }
}
