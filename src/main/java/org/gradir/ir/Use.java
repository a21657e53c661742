/*
 * Copyright 2025 The Gradir Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.gradir.ir;

import java.util.Objects;

/**
 * A Use records that a {@link Value} is the {@link #offset}th input of {@link #user}. Uses are
 * immutable; if a node's inputs are renumbered the affected Uses are replaced.
 */
public final class Use {
  public final Node user;
  public final int offset;

  Use(Node user, int offset) {
    this.user = user;
    this.offset = offset;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof Use use && user == use.user && offset == use.offset;
  }

  @Override
  public int hashCode() {
    return Objects.hash(System.identityHashCode(user), offset);
  }

  @Override
  public String toString() {
    return user.kind() + "#" + offset;
  }
}
