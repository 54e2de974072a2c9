// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import static io.github.simbo1905.graph.identity.GraphPickler.LOGGER;

/// The loading side of [GraphArchive]. Pointers visited through it hold no usable value until completion has read
/// the identity map that follows the payload.
public final class InputGraphArchive extends GraphArchive<InputArchive, LoadTracker> {

  public InputGraphArchive(InputArchive archive) {
    super(archive, new LoadTracker());
    if (archive.isSaving()) {
      throw new IllegalArgumentException("InputGraphArchive cannot be used with an output archive: " + archive);
    }
    LOGGER.fine(() -> "InputGraphArchive wrapping " + archive.getClass().getSimpleName());
  }

  @Override
  public InputGraphArchive visit(Object... values) {
    super.visit(values);
    return this;
  }

  @Override
  void completeTracking() {
    tracker.complete(archive);
  }
}
