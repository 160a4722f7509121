// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// The global snapshot algorithms: Chandy-Lamport over FIFO channels and Lai-Yang over non-FIFO channels.
package com.github.nodegrid.snapshot;
