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
import us.blanshard.sudokucsp.core.NumSet;
import us.blanshard.sudokucsp.core.Numeral;
import us.blanshard.sudokucsp.core.Unit;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSetMultimap;

import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * Why an empty cell has the candidates it has: the values present in each of
 * its units, and for every excluded value the units that exclude it.
 */
@Immutable
public final class Explanation {
  private static final Joiner JOINER = Joiner.on(", ");

  private final Location location;
  private final NumSet rowValues;
  private final NumSet columnValues;
  private final NumSet boxValues;
  private final ImmutableSetMultimap<Numeral, Unit.Type> exclusions;

  Explanation(Location location, NumSet rowValues, NumSet columnValues, NumSet boxValues) {
    this.location = checkNotNull(location);
    this.rowValues = rowValues;
    this.columnValues = columnValues;
    this.boxValues = boxValues;
    ImmutableSetMultimap.Builder<Numeral, Unit.Type> builder = ImmutableSetMultimap.builder();
    for (Numeral num : Numeral.ALL) {
      if (rowValues.contains(num)) builder.put(num, Unit.Type.ROW);
      if (columnValues.contains(num)) builder.put(num, Unit.Type.COLUMN);
      if (boxValues.contains(num)) builder.put(num, Unit.Type.BLOCK);
    }
    this.exclusions = builder.build();
  }

  public Location getLocation() {
    return location;
  }

  /** The values still legal in the cell. */
  public NumSet getCandidates() {
    return getExcluded().not();
  }

  /** The values ruled out by at least one of the cell's units. */
  public NumSet getExcluded() {
    return rowValues.or(columnValues).or(boxValues);
  }

  /** The kinds of unit that rule out the given value; empty if it is a candidate. */
  public Set<Unit.Type> getExcludingUnits(Numeral num) {
    return exclusions.get(num);
  }

  /** All exclusions, keyed by value in increasing order. */
  public ImmutableSetMultimap<Numeral, Unit.Type> getExclusions() {
    return exclusions;
  }

  public NumSet getRowValues() {
    return rowValues;
  }

  public NumSet getColumnValues() {
    return columnValues;
  }

  public NumSet getBoxValues() {
    return boxValues;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Explanation)) return false;
    Explanation that = (Explanation) o;
    return this.location == that.location
        && this.rowValues.equals(that.rowValues)
        && this.columnValues.equals(that.columnValues)
        && this.boxValues.equals(that.boxValues);
  }

  @Override public int hashCode() {
    return location.index * 31 + exclusions.hashCode();
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    NumSet candidates = getCandidates();
    if (candidates.isEmpty())
      sb.append("Cell ").append(location).append(" has no valid candidates\n");
    else
      sb.append("Candidates for cell ").append(location).append(": ")
          .append(JOINER.join(candidates)).append('\n');
    sb.append(location.row).append(" contains: ").append(list(rowValues)).append('\n');
    sb.append(location.column).append(" contains: ").append(list(columnValues)).append('\n');
    sb.append(location.block).append(" contains: ").append(list(boxValues)).append('\n');
    sb.append("Blocked: ").append(list(getExcluded()));
    return sb.toString();
  }

  private static String list(NumSet nums) {
    return nums.isEmpty() ? "none" : JOINER.join(nums);
  }
}
