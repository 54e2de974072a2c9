// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

/// An engine that writes. Beyond ordinary visiting it must be able to append one extra sequence of integers
/// after the main payload, which is where the identity map goes.
public interface OutputArchive extends EncodingVisitor {

  @Override
  default boolean isSaving() {
    return true;
  }

  /// Append a length prefixed sequence of non-negative integers.
  void appendSequence(int[] values);
}
