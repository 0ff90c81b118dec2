// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
/// Content addressing and chain integrity for settlement corridors.
///
/// Every record that is hashed goes through one pipeline:
/// ```
/// value ── Canonicalizer ──> CanonicalBytes ── Digester ──> ContentDigest
/// ```
/// [com.github.corridor_chain.CanonicalBytes] and [com.github.corridor_chain.ContentDigest] have no public
/// constructors so that no other path can produce them. Two nodes that canonicalize the same value agree on its
/// digest byte for byte.
///
/// Sub-packages:
/// - `mmr`: the Merkle Mountain Range that commits to the receipt sequence and its inclusion proofs.
/// - `receipt`: receipts, the per-corridor `ReceiptChain` and checkpoints.
/// - `fork`: detecting and deterministically resolving competing observations of a chain position.
/// - `anchor`: the optional capability to commit checkpoint digests to an external ledger.
///
/// [com.github.corridor_chain.ChainEngine] gives one chain a single writer and a durable
/// [com.github.corridor_chain.ChainJournal]; [com.github.corridor_chain.CorridorRegistry] holds one engine per
/// corridor.
package com.github.corridor_chain;
