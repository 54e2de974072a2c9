// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import java.util.Objects;
import java.util.function.Consumer;

/// A pointer assignment deferred until the identity map has been read, typed by the class the pointer may hold.
record PendingAssignment<T>(Class<T> type, Consumer<? super T> setter) {
  PendingAssignment {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(setter, "setter must not be null");
  }

  static <T> PendingAssignment<T> of(RawPointer<T> pointer) {
    return new PendingAssignment<>(pointer.type(), pointer::assign);
  }

  void assign(int pointerIndex, Object target) {
    if (target != null && !type.isInstance(target)) {
      throw new GraphIdentityException(GraphIdentityException.Reason.TARGET_TYPE_MISMATCH,
          "Pointer " + pointerIndex + " of type " + type.getName() + " cannot refer to " + target);
    }
    setter.accept(type.cast(target));
  }
}
