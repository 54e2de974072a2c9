// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import java.util.Objects;

/// Thrown when pointer identities cannot be saved or restored. The traversal that threw cannot be resumed and any
/// bytes it produced must be discarded.
public final class GraphIdentityException extends RuntimeException {

  public enum Reason {
    /// On save, a pointer refers to an object that the traversal never visited.
    TARGET_NOT_TRAVERSED,
    /// On load, the identity map does not have one entry per pointer in the traversal.
    SIZE_MISMATCH,
    /// On load, an identity map entry is beyond the objects constructed by the traversal.
    ID_OUT_OF_RANGE,
    /// A value was visited after the identity map had been written or read.
    USE_AFTER_COMPLETE,
    /// On load, an identity map entry resolves to an object the pointer cannot hold.
    TARGET_TYPE_MISMATCH
  }

  private final Reason reason;

  GraphIdentityException(Reason reason, String message) {
    super(message);
    this.reason = Objects.requireNonNull(reason);
  }

  public Reason reason() {
    return reason;
  }
}
