// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.graph.identity;

import java.util.Objects;

/// A value with a field name for engines with a self describing format. The binary engine and the trackers unwrap
/// it and visit [#value()] as though the name were not there.
public record NamedValue(String name, Object value) {
  public NamedValue {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(value, "value must not be null");
  }

  public static NamedValue of(String name, Object value) {
    return new NamedValue(name, value);
  }
}
