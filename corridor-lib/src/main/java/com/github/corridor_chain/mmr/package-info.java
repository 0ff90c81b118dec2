// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// An append-only Merkle Mountain Range over hex encoded 32 byte leaves. A range of 11 leaves has peaks of height
/// 3, 1 and 0:
/// ```
///             p0
///         /        \
///       .            .
///      / \          / \
///     .   .        .   .        p1
///    / \ / \      / \ / \      /  \
///   0  1 2  3    4  5 6  7    8    9    10 = p2
/// ```
/// The root is `node(p0, node(p1, p2))`. Proofs walk from a leaf to its peak and then bag the peaks.
package com.github.corridor_chain.mmr;
