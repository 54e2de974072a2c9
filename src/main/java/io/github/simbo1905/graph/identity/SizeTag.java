// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.function.IntConsumer;
import java.util.function.IntSupplier;

/// The length of a sequence. On load the engine applies the decoded length immediately so that the caller can go on
/// to visit that many elements.
public final class SizeTag {
  private final IntSupplier getter;
  private final IntConsumer setter;

  private SizeTag(IntSupplier getter, IntConsumer setter) {
    this.getter = Objects.requireNonNull(getter, "getter must not be null");
    this.setter = Objects.requireNonNull(setter, "setter must not be null");
  }

  public static @NotNull SizeTag of(IntSupplier getter, IntConsumer setter) {
    return new SizeTag(getter, setter);
  }

  public int get() {
    return getter.getAsInt();
  }

  void set(int size) {
    setter.accept(size);
  }

  @Override
  public String toString() {
    return "SizeTag";
  }
}
