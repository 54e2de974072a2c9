// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import static io.github.simbo1905.graph.identity.GraphPickler.LOGGER;

/// The saving side of [GraphArchive]. On completion it appends one object-id per pointer after the payload.
public final class OutputGraphArchive extends GraphArchive<OutputArchive, SaveTracker> {

  public OutputGraphArchive(OutputArchive archive) {
    super(archive, new SaveTracker());
    if (!archive.isSaving()) {
      throw new IllegalArgumentException("OutputGraphArchive cannot be used with an input archive: " + archive);
    }
    LOGGER.fine(() -> "OutputGraphArchive wrapping " + archive.getClass().getSimpleName());
  }

  @Override
  public OutputGraphArchive visit(Object... values) {
    super.visit(values);
    return this;
  }

  @Override
  void completeTracking() {
    tracker.complete(archive);
  }
}
