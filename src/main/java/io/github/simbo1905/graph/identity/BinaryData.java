// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/// An opaque block of bytes written with a length prefix. Trackers skip binary data entirely: it takes no object-id
/// and nothing inside it can be the target of a pointer.
public final class BinaryData {
  private final Supplier<byte[]> getter;
  private final Consumer<byte[]> setter;

  private BinaryData(Supplier<byte[]> getter, Consumer<byte[]> setter) {
    this.getter = Objects.requireNonNull(getter, "getter must not be null");
    this.setter = Objects.requireNonNull(setter, "setter must not be null");
  }

  public static @NotNull BinaryData of(Supplier<byte[]> getter, Consumer<byte[]> setter) {
    return new BinaryData(getter, setter);
  }

  byte[] get() {
    return Objects.requireNonNull(getter.get(), "binary data must not be null");
  }

  void set(byte[] bytes) {
    setter.accept(bytes);
  }

  @Override
  public String toString() {
    return "BinaryData";
  }
}
