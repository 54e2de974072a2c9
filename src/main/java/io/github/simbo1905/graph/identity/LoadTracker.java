// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import static io.github.simbo1905.graph.identity.GraphPickler.LOGGER;

/// Pointer book-keeping while loading. Runs after the engine has constructed and populated each value, records the
/// new units by object-id in the same order [SaveTracker] numbered the originals, and defers every pointer assignment
/// until [#complete(InputArchive)] has read the identity map.
public final class LoadTracker implements TrackingVisitor {
  private final List<Object> units = new ArrayList<>();
  private final List<PendingAssignment<?>> pendingAssignments = new ArrayList<>();
  private boolean completed;

  public LoadTracker() {
    // object-id 0 is null
    units.add(null);
  }

  @Override
  public void trackIdentity(Object unit) {
    Objects.requireNonNull(unit, "unit must not be null");
    units.add(unit);
  }

  @Override
  public <T> void trackPointer(RawPointer<T> pointer) {
    pendingAssignments.add(PendingAssignment.of(pointer));
    trackIdentity(pointer.slot());
  }

  /// Read one object-id per pointer from the archive and assign each pointer its target. Does nothing if already
  /// called.
  /// @throws GraphIdentityException if the identity map does not fit this traversal
  public void complete(InputArchive archive) {
    Objects.requireNonNull(archive, "archive must not be null");
    if (completed) {
      return;
    }
    completed = true;

    final int[] pointerToObjectId = archive.readSequence();
    if (pointerToObjectId.length != pendingAssignments.size()) {
      throw new GraphIdentityException(GraphIdentityException.Reason.SIZE_MISMATCH,
          "Identity map read from the archive has " + pointerToObjectId.length +
              " entries but the traversal found " + pendingAssignments.size() + " pointers");
    }
    for (int i = 0; i < pointerToObjectId.length; i++) {
      final int objectId = pointerToObjectId[i];
      if (objectId < 0 || objectId >= units.size()) {
        throw new GraphIdentityException(GraphIdentityException.Reason.ID_OUT_OF_RANGE,
            "Pointer " + i + " has object-id " + objectId + " exceeding the traversal count " + units.size());
      }
      pendingAssignments.get(i).assign(i, units.get(objectId));
    }
    LOGGER.fine(() -> "LoadTracker assigned " + pointerToObjectId.length + " pointers against " +
        (units.size() - 1) + " traversed units");
  }

  int pointerCount() {
    return pendingAssignments.size();
  }

  int unitCount() {
    return units.size() - 1;
  }
}
