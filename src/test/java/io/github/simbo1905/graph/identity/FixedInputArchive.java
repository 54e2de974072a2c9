// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.graph.identity;

/// Reads no payload and hands back a fixed identity map, for driving a [LoadTracker] directly.
class FixedInputArchive implements InputArchive {
  final int[] identityMap;

  FixedInputArchive(int... identityMap) {
    this.identityMap = identityMap;
  }

  @Override
  public FixedInputArchive visit(Object... values) {
    return this;
  }

  @Override
  public int[] readSequence() {
    return identityMap.clone();
  }
}
