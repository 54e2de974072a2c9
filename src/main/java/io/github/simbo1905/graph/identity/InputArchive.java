// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

/// An engine that reads. Mirrors [OutputArchive#appendSequence(int[])] with [#readSequence()].
public interface InputArchive extends EncodingVisitor {

  @Override
  default boolean isSaving() {
    return false;
  }

  /// Read back a sequence written by [OutputArchive#appendSequence(int[])].
  int[] readSequence();
}
