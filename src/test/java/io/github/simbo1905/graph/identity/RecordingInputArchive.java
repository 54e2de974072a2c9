// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.graph.identity;

import java.nio.ByteBuffer;

/// Delegates to a [BinaryInputArchive] and counts identity map reads.
final class RecordingInputArchive implements InputArchive {
  final BinaryInputArchive delegate;
  int sequenceReads;

  RecordingInputArchive(ByteBuffer buffer) {
    this.delegate = new BinaryInputArchive(buffer);
  }

  @Override
  public RecordingInputArchive visit(Object... values) {
    delegate.visit(values);
    return this;
  }

  @Override
  public int[] readSequence() {
    sequenceReads++;
    return delegate.readSequence();
  }
}
