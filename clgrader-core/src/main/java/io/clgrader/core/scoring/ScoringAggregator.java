package io.clgrader.core.scoring;

import io.clgrader.core.assessment.GradingMode;
import io.clgrader.core.exception.AggregationException;
import io.clgrader.core.result.NodeKind;
import io.clgrader.core.result.ResultNode;
import io.clgrader.core.result.ResultStatus;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/// Folds leaf verdicts into scores, bottom-up.
///
/// ### Weighted mode
/// A leaf earns its weight when it passed and nothing otherwise; its possible weight is
/// always its weight. Interior nodes sum their children. A section multiplies both sums
/// by its own weight. The score is `earned / possible`, or `1.0` when nothing was possible.
///
/// ### Absolute mode
/// The score is `1.0` if every leaf of the subtree passed (an empty subtree passes) and
/// `0.0` otherwise. Possible weight sums as in weighted mode, but a node earns either all
/// of it or nothing, so an absolute section inside a weighted parent contributes its
/// whole weight or none of it.
///
/// A section's grading-mode override applies to its own subtree; everything else uses
/// the mode passed to {@link #aggregate}.
///
/// ### Interior status
/// - no children, or every child passed: {@link ResultStatus#PASSED}
/// - every child skipped: {@link ResultStatus#SKIPPED}
/// - some child passed or partially passed: {@link ResultStatus#PARTIALLY_PASSED}
/// - otherwise {@link ResultStatus#ERRORED} if a child errored, else {@link ResultStatus#FAILED}
///
/// An interior node that arrives already {@link ResultStatus#ERRORED} with no children
/// (its executor crashed) stays errored and scores zero.
///
/// @implNote **Stateless and thread-safe**.
public class ScoringAggregator {

    /// Scores a result tree.
    ///
    /// @param root unscored tree, not null
    /// @param mode grading mode of the root, not null
    /// @return a scored copy of the tree, never null
    /// @throws AggregationException if a leaf or section carries a negative weight, or a
    ///     leaf has no status
    public ResultNode aggregate(ResultNode root, GradingMode mode) throws AggregationException {
        return fold(root, mode).node();
    }

    private Folded fold(ResultNode node, GradingMode inherited) throws AggregationException {
        GradingMode mode =
                node.getKind() == NodeKind.SECTION && node.getGradingMode() != null
                        ? node.getGradingMode()
                        : inherited;
        if (node.getKind().isLeaf()) {
            return foldLeaf(node, mode);
        }
        if (node.getWeight() < 0) {
            throw new AggregationException(
                    "Negative weight " + node.getWeight() + " on " + describe(node));
        }
        if (node.getChildren().isEmpty() && node.getStatus() == ResultStatus.ERRORED) {
            ResultNode errored =
                    node.toBuilder().earned(0).possible(0).score(0.0).gradingMode(mode).build();
            return new Folded(errored, false);
        }

        List<ResultNode> children = new ArrayList<>(node.getChildren().size());
        long earned = 0;
        long possible = 0;
        boolean allPassed = true;
        for (ResultNode child : node.getChildren()) {
            Folded folded = fold(child, mode);
            children.add(folded.node());
            earned += folded.node().getEarned();
            possible += folded.node().getPossible();
            allPassed &= folded.allLeavesPassed();
        }
        if (node.getKind() == NodeKind.SECTION) {
            earned *= node.getWeight();
            possible *= node.getWeight();
        }
        if (mode == GradingMode.ABSOLUTE) {
            earned = allPassed ? possible : 0;
        }

        ResultNode scored =
                node.toBuilder()
                        .children(children)
                        .status(interiorStatus(children))
                        .earned(earned)
                        .possible(possible)
                        .score(score(mode, earned, possible, allPassed))
                        .gradingMode(mode)
                        .build();
        return new Folded(scored, allPassed);
    }

    private Folded foldLeaf(ResultNode leaf, GradingMode mode) throws AggregationException {
        if (leaf.getWeight() < 0) {
            throw new AggregationException(
                    "Negative weight " + leaf.getWeight() + " on " + describe(leaf));
        }
        if (leaf.getStatus() == null) {
            throw new AggregationException("Leaf without status: " + describe(leaf));
        }
        boolean passed = leaf.isPassed();
        ResultNode scored =
                leaf.toBuilder()
                        .earned(passed ? leaf.getWeight() : 0)
                        .possible(leaf.getWeight())
                        .score(passed ? 1.0 : 0.0)
                        .gradingMode(mode)
                        .build();
        return new Folded(scored, passed);
    }

    static double score(GradingMode mode, long earned, long possible, boolean allPassed) {
        if (mode == GradingMode.ABSOLUTE) {
            return allPassed ? 1.0 : 0.0;
        }
        return possible == 0 ? 1.0 : (double) earned / possible;
    }

    static ResultStatus interiorStatus(List<ResultNode> children) {
        if (children.isEmpty()) {
            return ResultStatus.PASSED;
        }
        boolean allPassed = true;
        boolean allSkipped = true;
        boolean anyPassed = false;
        boolean anyErrored = false;
        for (ResultNode child : children) {
            ResultStatus status = child.getStatus();
            allPassed &= status == ResultStatus.PASSED;
            allSkipped &= status == ResultStatus.SKIPPED;
            anyPassed |= status == ResultStatus.PASSED || status == ResultStatus.PARTIALLY_PASSED;
            anyErrored |= status == ResultStatus.ERRORED;
        }
        if (allPassed) {
            return ResultStatus.PASSED;
        }
        if (allSkipped) {
            return ResultStatus.SKIPPED;
        }
        if (anyPassed) {
            return ResultStatus.PARTIALLY_PASSED;
        }
        return anyErrored ? ResultStatus.ERRORED : ResultStatus.FAILED;
    }

    private static String describe(ResultNode node) {
        return node.getKind().name().toLowerCase(Locale.ROOT) + " '" + node.getName() + "'";
    }

    private record Folded(ResultNode node, boolean allLeavesPassed) {}
}
