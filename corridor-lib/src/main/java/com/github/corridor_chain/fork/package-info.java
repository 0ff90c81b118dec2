// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Fork handling. A fork is two observations of the same chain position with different receipt digests. The
/// [com.github.corridor_chain.fork.ForkResolver] is a pure function over the two branches plus a clock bound, so
/// every honest node reaches the same decision without talking to the others.
package com.github.corridor_chain.fork;
