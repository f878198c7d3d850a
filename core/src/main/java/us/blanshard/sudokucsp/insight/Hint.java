/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.sudokucsp.insight;

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.sudokucsp.core.Location;

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A suggested value for one cell, with the reasoning behind it.
 */
@Immutable
public final class Hint {

  /** How the suggested value was arrived at. */
  public enum Kind {
    /** The value is the cell's only candidate. */
    NAKED_SINGLE,
    /** The value has no other place in one of the cell's units. */
    HIDDEN_SINGLE,
    /** Nothing is forced; the value is the smallest candidate. */
    GUESS,
    /** The cell has no candidates at all; the value is 0. */
    NONE;

    public boolean isForced() {
      return this == NAKED_SINGLE || this == HIDDEN_SINGLE;
    }
  }

  private final Location location;
  private final int value;
  private final Kind kind;
  @Nullable private final Insight insight;
  private final Explanation explanation;

  Hint(Location location, int value, Kind kind, @Nullable Insight insight,
       Explanation explanation) {
    this.location = checkNotNull(location);
    this.value = value;
    this.kind = checkNotNull(kind);
    this.insight = insight;
    this.explanation = checkNotNull(explanation);
  }

  public Location getLocation() {
    return location;
  }

  /** The suggested value, 1..9, or 0 when the kind is {@link Kind#NONE}. */
  public int getValue() {
    return value;
  }

  public Kind getKind() {
    return kind;
  }

  /** The naked or hidden single that forces the value, null for guesses. */
  @Nullable public Insight getInsight() {
    return insight;
  }

  public Explanation getExplanation() {
    return explanation;
  }

  /** Returns a one-line description of the hint for display. */
  public String describe() {
    switch (kind) {
      case NAKED_SINGLE:
      case HIDDEN_SINGLE:
        return insight.describe();
      case GUESS:
        return String.format("Nothing is forced at %s; %d is its smallest candidate", location, value);
      default:
        return String.format("Cell %s has no valid candidates", location);
    }
  }

  @Override public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("location", location)
        .add("value", value)
        .add("kind", kind)
        .toString();
  }
}
