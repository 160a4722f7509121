// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Leader election on a unidirectional ring.
package com.github.nodegrid.election;
