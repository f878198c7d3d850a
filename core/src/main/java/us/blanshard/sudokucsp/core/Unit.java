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
package us.blanshard.sudokucsp.core;

import com.google.common.collect.ImmutableList;

import java.util.AbstractCollection;
import java.util.Iterator;

import javax.annotation.concurrent.Immutable;

/**
 * A row, column, or block of a Sudoku grid: 9 locations whose values must all
 * differ.  Each unit is a read-only collection of its locations.
 */
@Immutable
public abstract class Unit extends AbstractCollection<Location> {

  public enum Type {
    ROW, COLUMN, BLOCK
  }

  /** Returns all 27 units: the rows, then the columns, then the blocks. */
  public static ImmutableList<Unit> allUnits() {
    return Units.ALL;
  }

  public abstract Type getType();

  /** Returns the numerals set in this unit in the given grid. */
  public final NumSet getValues(Grid grid) {
    return NumSet.ofBits(valueBits(grid));
  }

  /** Returns the numerals not yet set in this unit in the given grid. */
  public final NumSet getMissing(Grid grid) {
    return NumSet.ofBits(NumSet.ALL_BITS & ~valueBits(grid));
  }

  /** Returns the numerals set more than once in this unit in the given grid. */
  public final NumSet getConflicts(Grid grid) {
    int seen = 0;
    int repeated = 0;
    for (Location loc : this) {
      int bit = grid.getBit(loc);
      repeated |= seen & bit;
      seen |= bit;
    }
    return NumSet.ofBits(repeated);
  }

  private int valueBits(Grid grid) {
    int bits = 0;
    for (Location loc : this)
      bits |= grid.getBit(loc);
    return bits;
  }

  public final boolean contains(Location loc) {
    return loc.unit(getType()) == this;
  }

  @Override public final boolean contains(Object o) {
    return o instanceof Location && contains((Location) o);
  }

  @Override public final int size() {
    return 9;
  }

  @Override public final Iterator<Location> iterator() {
    return Location.iterator(locations);
  }

  /** Grid indices of the member locations, in reading order. */
  protected final byte[] locations = new byte[9];

  // Kept apart from Unit so the subclasses can finish initializing first.
  private static class Units {
    static final ImmutableList<Unit> ALL = ImmutableList.<Unit>builder()
        .addAll(Row.ALL)
        .addAll(Column.ALL)
        .addAll(Block.ALL)
        .build();
  }
}
