// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.nodegrid;

import java.util.Objects;

/// The result of running an algorithm over a graph. An incomplete snapshot or a failed election is a normal outcome
/// of a run and is reported as [Outcome#INCOMPLETE]. Only bad input or a broken engine is [Outcome#FAILED].
///
/// @param algorithm The algorithm that was run.
/// @param outcome   How the run ended.
/// @param detail    The verdict of the run or the reason it failed.
public record RunResult(SelectedAlgorithm algorithm, Outcome outcome, String detail) {
  public enum Outcome {
    /// The snapshot is complete or a leader was elected.
    COMPLETED,
    /// The run finished but the snapshot did not complete or no leader was elected.
    INCOMPLETE,
    /// No simulation was attempted or it was stopped by an error.
    FAILED
  }

  public RunResult {
    Objects.requireNonNull(algorithm, "algorithm");
    Objects.requireNonNull(outcome, "outcome");
    Objects.requireNonNull(detail, "detail");
  }

  public static RunResult completed(SelectedAlgorithm algorithm, String detail) {
    return new RunResult(algorithm, Outcome.COMPLETED, detail);
  }

  public static RunResult incomplete(SelectedAlgorithm algorithm, String detail) {
    return new RunResult(algorithm, Outcome.INCOMPLETE, detail);
  }

  public static RunResult failed(SelectedAlgorithm algorithm, String reason) {
    return new RunResult(algorithm, Outcome.FAILED, reason);
  }

  /// @return true if the run went to the end whatever the verdict.
  public boolean isSuccess() {
    return outcome != Outcome.FAILED;
  }

  public boolean isCompleted() {
    return outcome == Outcome.COMPLETED;
  }
}
