// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.graph.identity.model;

import io.github.simbo1905.graph.identity.ThisReference;
import io.github.simbo1905.graph.identity.Traversable;
import io.github.simbo1905.graph.identity.Value;
import io.github.simbo1905.graph.identity.Visitor;

public final class Leaf implements Traversable {
  public String label;

  @Override
  public void traverse(Visitor visitor) {
    visitor.visit(Value.ofString(() -> label, v -> label = v), ThisReference.of(this));
  }
}
