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

import static com.google.common.base.Preconditions.checkElementIndex;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;

import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * A cell of a Sudoku grid.  Rows and columns are indexed from 0; the
 * locations themselves are indexed 0..80 in row-major order.
 */
@Immutable
public final class Location implements Comparable<Location> {

  /** The number of distinct locations. */
  public static final int COUNT = 81;

  public final Row row;
  public final Column column;
  public final Block block;

  /** The 3 units this location belongs to: row, column, and block, in that order. */
  public final List<Unit> units;

  /** The 20 locations in all the units, not counting this one. */
  public final List<Location> peers;

  /** A number in the range [0, COUNT). */
  public final int index;

  public static Location of(Row row, Column column) {
    return of(row.index * 9 + column.index);
  }

  /**
   * Returns the location at the given 0-based row and column.
   *
   * @throws IndexOutOfBoundsException if either is outside 0..8
   */
  public static Location of(int rowIndex, int columnIndex) {
    checkElementIndex(rowIndex, 9, "row");
    checkElementIndex(columnIndex, 9, "column");
    return instances[rowIndex * 9 + columnIndex];
  }

  public static Location of(int index) {
    return instances[checkElementIndex(index, COUNT)];
  }

  /** All locations, in row-major order. */
  public static final List<Location> ALL;

  public Unit unit(Unit.Type type) {
    switch (type) {
      case ROW: return row;
      case COLUMN: return column;
      default: return block;
    }
  }

  @Override public int compareTo(Location that) {
    return this.index - that.index;
  }

  @Override public String toString() {
    return String.format("(%d, %d)", row.index + 1, column.index + 1);
  }

  static Iterator<Location> iterator(byte[] indices) {
    return new Iter(indices);
  }

  private static class Iter implements Iterator<Location> {
    private final byte[] indices;
    private int next;
    private Iter(byte[] indices) {
      this.indices = indices;
    }
    @Override public boolean hasNext() {
      return next < indices.length;
    }
    @Override public Location next() {
      if (!hasNext()) throw new NoSuchElementException();
      return instances[indices[next++]];
    }
    @Override public void remove() {
      throw new UnsupportedOperationException();
    }
  }

  private Location(int index) {
    this.index = index;
    this.row = Row.ofIndex(index / 9);
    this.column = Column.ofIndex(index % 9);
    this.block = Block.containing(index / 9, index % 9);
    this.units = ImmutableList.<Unit>of(row, column, block);
    this.peersArray = new Location[20];  // Filled in later, see static block below.
    this.peers = Collections.unmodifiableList(Arrays.asList(peersArray));
  }

  private final Location[] peersArray;
  private static final Location[] instances;
  static {
    instances = new Location[COUNT];
    for (int i = 0; i < COUNT; ++i) {
      instances[i] = new Location(i);
    }
    ALL = Collections.unmodifiableList(Arrays.asList(instances));
    for (Location loc : instances) {
      Set<Location> peers = Sets.newLinkedHashSet();
      peers.addAll(loc.row);
      peers.addAll(loc.column);
      peers.addAll(loc.block);
      peers.remove(loc);
      peers.toArray(loc.peersArray);
    }
  }
}
