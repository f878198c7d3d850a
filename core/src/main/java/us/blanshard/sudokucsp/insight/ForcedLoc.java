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

import us.blanshard.sudokucsp.core.Assignment;
import us.blanshard.sudokucsp.core.Constraints;
import us.blanshard.sudokucsp.core.Grid;
import us.blanshard.sudokucsp.core.Location;
import us.blanshard.sudokucsp.core.Numeral;
import us.blanshard.sudokucsp.core.Unit;

import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * Describes a situation where there is only one possible location within a unit
 * for a given numeral: a hidden single.
 */
@Immutable
public final class ForcedLoc extends Insight {
  private final Unit unit;
  private final Numeral numeral;
  private final Location location;

  public ForcedLoc(Unit unit, Numeral numeral, Location location) {
    super(Type.FORCED_LOCATION);
    this.unit = checkNotNull(unit);
    this.numeral = checkNotNull(numeral);
    this.location = checkNotNull(location);
  }

  public Unit getUnit() {
    return unit;
  }

  public Numeral getNumeral() {
    return numeral;
  }

  public Location getLocation() {
    return location;
  }

  @Override public Assignment getAssignment() {
    return Assignment.of(location, numeral);
  }

  @Override public boolean isImpliedBy(Grid grid) {
    if (unit.getValues(grid).contains(numeral)) return false;
    Location found = null;
    for (Location loc : unit) {
      if (Constraints.candidates(grid, loc).contains(numeral)) {
        if (found != null) return false;
        found = loc;
      }
    }
    return found == location;
  }

  @Override public String describe() {
    return String.format("Hidden single: %d can only go at %s in %s",
        numeral.number, location, unit);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (o == null || o.getClass() != getClass()) return false;
    ForcedLoc that = (ForcedLoc) o;
    return this.unit.equals(that.unit)
        && this.numeral.equals(that.numeral)
        && this.location.equals(that.location);
  }

  @Override public int hashCode() {
    return Objects.hashCode(unit, numeral, location);
  }

  @Override public String toString() {
    return numeral + " \u2208 " + unit + " \u2192 " + location;  // element-of, right-arrow
  }
}
