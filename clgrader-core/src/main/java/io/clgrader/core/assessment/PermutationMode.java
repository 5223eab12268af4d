package io.clgrader.core.assessment;

/// How the results of several argument permutations of one test case combine.
public enum PermutationMode {

    /// Every permutation must pass.
    ALL_OF,

    /// At least one permutation must pass.
    ANY_OF
}
