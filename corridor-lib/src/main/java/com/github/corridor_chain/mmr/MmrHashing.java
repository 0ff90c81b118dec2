// SPDX-FileCopyrightText: 2024 - 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
package com.github.corridor_chain.mmr;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

import static com.github.corridor_chain.mmr.MmrException.Reason.MALFORMED_LEAF;

/// The node hashing of the mountain range. Leaves and interior nodes are domain separated so that a leaf can never
/// be passed off as an interior node:
///
/// - leaf: `sha256(0x00 || leaf)`
/// - node: `sha256(0x01 || left || right)`
///
/// All values are 32 byte hashes carried as 64 character lower case hex.
public final class MmrHashing {
  static final HexFormat HEX = HexFormat.of();
  static final int HASH_LENGTH = 32;
  private static final byte LEAF_PREFIX = 0x00;
  private static final byte NODE_PREFIX = 0x01;

  private MmrHashing() {
  }

  /// @return true when `hex` is exactly 64 hexadecimal characters
  public static boolean isHex32(String hex) {
    if (hex == null || hex.length() != HASH_LENGTH * 2) {
      return false;
    }
    for (int i = 0; i < hex.length(); i++) {
      if (Character.digit(hex.charAt(i), 16) < 0) {
        return false;
      }
    }
    return true;
  }

  /// Validates and lower cases a 64 character hex value. Nothing is trimmed or truncated.
  public static String normalize(String hex) {
    if (!isHex32(hex)) {
      throw new MmrException(MALFORMED_LEAF, "expected 64 hex chars but got "
          + (hex == null ? "null" : "'" + hex + "' (" + hex.length() + " chars)"));
    }
    return hex.toLowerCase(java.util.Locale.ROOT);
  }

  public static String leafHash(String leafHex) {
    final var md = sha256();
    md.update(LEAF_PREFIX);
    md.update(HEX.parseHex(normalize(leafHex)));
    return HEX.formatHex(md.digest());
  }

  public static String nodeHash(String leftHex, String rightHex) {
    final var md = sha256();
    md.update(NODE_PREFIX);
    md.update(HEX.parseHex(normalize(leftHex)));
    md.update(HEX.parseHex(normalize(rightHex)));
    return HEX.formatHex(md.digest());
  }

  /// Folds the peaks right to left: `node(p0, node(p1, ... node(pn-1, pn)))`. No peaks gives the empty string.
  public static String bagPeaks(List<Peak> peaks) {
    if (peaks.isEmpty()) {
      return "";
    }
    String bag = peaks.get(peaks.size() - 1).hash();
    for (int i = peaks.size() - 2; i >= 0; i--) {
      bag = nodeHash(peaks.get(i).hash(), bag);
    }
    return bag;
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
