package io.assay.core.result;

/// Final outcome of one executed (or skipped) test case.
///
/// Constants are declared from most to least important. When several conditions
/// apply to the same case (a body failure followed by a failing cleanup, the rows of
/// one descriptor) the more important outcome wins, see {@link #moreImportant(Outcome)}.
///
/// @see CaseResult#getOutcome()
public enum Outcome {
    FAILED,
    TIMED_OUT,
    INCONCLUSIVE,
    NOT_RUNNABLE,
    NOT_FOUND,
    PASSED,
    IGNORED;

    /// Returns whichever of this and `other` is the more important outcome.
    ///
    /// @param other outcome to compare with, may be null
    /// @return the more important outcome, never null
    public Outcome moreImportant(Outcome other) {
        if (other == null) {
            return this;
        }
        return other.ordinal() < ordinal() ? other : this;
    }

    /// Returns whether this outcome counts as a failed case in run summaries.
    ///
    /// @return true for {@link #FAILED}, {@link #TIMED_OUT}, {@link #NOT_FOUND}
    /// and {@link #NOT_RUNNABLE}
    public boolean isFailure() {
        return this == FAILED || this == TIMED_OUT || this == NOT_FOUND || this == NOT_RUNNABLE;
    }
}
