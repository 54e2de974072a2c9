// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static io.github.simbo1905.graph.identity.GraphPickler.LOGGER;

/// Pointer book-keeping while saving. Associates the identity of every unit it is shown with an object-id and
/// remembers the target of every pointer, then on [#complete(OutputArchive)] writes one object-id per pointer.
///
/// A unit that is tracked more than once keeps the id of its most recent visit and pointers resolve to that id.
public final class SaveTracker implements TrackingVisitor {
  private final Map<Object, Integer> objectIds = new IdentityHashMap<>();
  private final List<Object> pointerTargets = new ArrayList<>();
  private int nextObjectId;
  private boolean completed;

  public SaveTracker() {
    // null is object-id 0
    objectIds.put(null, nextObjectId++);
  }

  @Override
  public void trackIdentity(Object unit) {
    Objects.requireNonNull(unit, "unit must not be null");
    final int objectId = nextObjectId++;
    objectIds.put(unit, objectId);
    LOGGER.finer(() -> "SaveTracker object-id " + objectId + " is " + unit);
  }

  @Override
  public <T> void trackPointer(RawPointer<T> pointer) {
    final T target = pointer.target();
    pointerTargets.add(target);
    trackIdentity(pointer.slot());
  }

  /// Resolve every pointer target to an object-id and append them to the archive. Does nothing if already called.
  /// @throws GraphIdentityException if a pointer refers to an object that was never traversed
  public void complete(OutputArchive archive) {
    Objects.requireNonNull(archive, "archive must not be null");
    if (completed) {
      return;
    }
    completed = true;

    final int[] pointerToObjectId = new int[pointerTargets.size()];
    for (int i = 0; i < pointerToObjectId.length; i++) {
      final Object target = pointerTargets.get(i);
      final Integer objectId = objectIds.get(target);
      if (objectId == null) {
        throw new GraphIdentityException(GraphIdentityException.Reason.TARGET_NOT_TRAVERSED,
            "Pointer " + i + " refers to " + target.getClass().getName() + "@" +
                Integer.toHexString(System.identityHashCode(target)) + " which was not found in the traversal");
      }
      pointerToObjectId[i] = objectId;
    }
    LOGGER.fine(() -> "SaveTracker resolved " + pointerToObjectId.length + " pointers against " +
        (nextObjectId - 1) + " traversed units");
    archive.appendSequence(pointerToObjectId);
  }

  int pointerCount() {
    return pointerTargets.size();
  }

  int unitCount() {
    return nextObjectId - 1;
  }
}
