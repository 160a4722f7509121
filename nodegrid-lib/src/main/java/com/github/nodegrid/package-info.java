// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// This package contains the core of the NodeGrid simulation engine which runs classic distributed algorithms as a
/// deterministic sequential event loop over an in-memory queue.
///
/// The caller hands a graph of [com.github.nodegrid.GraphNode] to a [com.github.nodegrid.NodeGrid] and calls
/// `runAlgorithm` with a [com.github.nodegrid.SelectedAlgorithm] and a list to append the trace to. The result is a
/// [com.github.nodegrid.RunResult].
///
/// Supporting classes and interfaces:
/// - [com.github.nodegrid.Simulation]: The event loop that owns the wrapped nodes and the pending messages of a run.
/// - [com.github.nodegrid.SimNode] and [com.github.nodegrid.SimMessage]: What each algorithm implements.
/// - [com.github.nodegrid.ChannelDiscipline] and [com.github.nodegrid.MessageQueue]: FIFO or randomised delivery.
/// - [com.github.nodegrid.LamportClock]: Logical time stamped on snapshot traffic.
/// - [com.github.nodegrid.Snapshot]: A node's recorded state and in-flight messages.
/// - [com.github.nodegrid.SimulationConfig]: How much background traffic to inject.
package com.github.nodegrid;
