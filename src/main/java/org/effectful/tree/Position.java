/*
 * Copyright 2025 The Effectful Authors
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

package org.effectful.tree;

/** A location in the host's source text, used to report diagnostics. Positions are immutable. */
public final class Position {

  /** Used for synthetic nodes that have no source location. */
  public static final Position NONE = new Position(0, 0);

  public final int lineNum;
  public final int charPositionInLine;

  private Position(int lineNum, int charPositionInLine) {
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
  }

  public static Position of(int lineNum, int charPositionInLine) {
    if (lineNum == 0 && charPositionInLine == 0) {
      return NONE;
    }
    return new Position(lineNum, charPositionInLine);
  }

  public boolean isDefined() {
    return this != NONE;
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    return obj instanceof Position
        && ((Position) obj).lineNum == lineNum
        && ((Position) obj).charPositionInLine == charPositionInLine;
  }

  @Override
  public int hashCode() {
    return lineNum * 31 + charPositionInLine;
  }

  @Override
  public String toString() {
    return lineNum + ":" + charPositionInLine;
  }
}
