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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static us.blanshard.sudokucsp.core.Numeral.numeral;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.Arrays;
import java.util.List;
import java.util.Set;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A mutable 9x9 Sudoku grid.  Each cell holds 0 (empty) or a value 1..9.  The
 * grid accepts any value at any cell: it does not enforce the rules of the
 * game, it only reports where they are broken.  Rows and columns are indexed
 * from 0.
 */
@NotThreadSafe
public final class Grid {

  private final byte[] squares;

  private Grid(byte[] squares) {
    this.squares = squares;
  }

  /** Creates an empty grid. */
  public Grid() {
    this(new byte[Location.COUNT]);
  }

  /** Returns an independent copy of this grid. */
  public Grid copy() {
    return new Grid(squares.clone());
  }

  /** Possible states for a Sudoku grid. */
  public enum State {
    WIN,         // Completely filled in, no rule violations.
    INCOMPLETE,  // Not all filled in, but nothing that is filled in breaks the rules.
    INVALID;     // Something that's filled in breaks the rules.
  }

  public State getState() {
    if (!getBrokenLocations().isEmpty())
      return State.INVALID;
    return isComplete() ? State.WIN : State.INCOMPLETE;
  }

  /** Returns the value at the given cell, 0 if it is empty. */
  public int get(int row, int col) {
    return squares[Location.of(row, col).index];
  }

  /**
   * Sets the value at the given cell; 0 empties it.
   *
   * @throws InvalidValueException if value is outside 0..9
   */
  public Grid set(int row, int col, int value) {
    Location loc = Location.of(row, col);
    Numeral num = numeral(value);
    squares[loc.index] = (byte) Numeral.number(num);
    return this;
  }

  /** Returns the numeral at the given location, or null. */
  @Nullable public Numeral get(Location loc) {
    return numeral(squares[loc.index]);
  }

  public Grid set(Location loc, Numeral num) {
    squares[loc.index] = (byte) num.number;
    return this;
  }

  /** Empties the given location. */
  public Grid clear(Location loc) {
    squares[loc.index] = 0;
    return this;
  }

  public boolean isEmpty(Location loc) {
    return squares[loc.index] == 0;
  }

  /** The bit of the numeral at the given location, or 0. */
  int getBit(Location loc) {
    int square = squares[loc.index];
    return square == 0 ? 0 : 1 << (square - 1);
  }

  /** Returns the nonzero values in the given row. */
  public NumSet rowValues(int row) {
    return Location.of(row, 0).row.getValues(this);
  }

  /** Returns the nonzero values in the given column. */
  public NumSet colValues(int col) {
    return Location.of(0, col).column.getValues(this);
  }

  /** Returns the nonzero values in the 3x3 box containing the given cell. */
  public NumSet boxValues(int row, int col) {
    return Location.of(row, col).block.getValues(this);
  }

  /**
   * Returns the values held by the given location's 20 peers, ie the union of
   * its row, column and box values ignoring the location itself.
   */
  public NumSet getPeerValues(Location loc) {
    int bits = 0;
    for (Location peer : loc.peers)
      bits |= getBit(peer);
    return NumSet.ofBits(bits);
  }

  /**
   * Tells whether placing the given value at the given cell would repeat a
   * value already in the cell's row, column or box.  The cell's own current
   * value is ignored.
   *
   * @throws InvalidValueException if value is outside 1..9
   */
  public boolean violatesConstraints(int row, int col, int value) {
    return violatesConstraints(Location.of(row, col), Numeral.of(value));
  }

  public boolean violatesConstraints(Location loc, Numeral num) {
    return getPeerValues(loc).contains(num);
  }

  /** Tells whether every cell is filled. */
  public boolean isComplete() {
    for (byte square : squares) {
      if (square == 0) return false;
    }
    return true;
  }

  /** Returns the number of filled cells. */
  public int size() {
    int answer = 0;
    for (byte square : squares) {
      if (square > 0) ++answer;
    }
    return answer;
  }

  /** Returns the empty locations in row-major order. */
  public List<Location> getEmptyLocations() {
    List<Location> answer = Lists.newArrayList();
    for (Location loc : Location.ALL) {
      if (squares[loc.index] == 0) answer.add(loc);
    }
    return answer;
  }

  /** Returns the filled locations in row-major order. */
  public List<Location> getFilledLocations() {
    List<Location> answer = Lists.newArrayList();
    for (Location loc : Location.ALL) {
      if (squares[loc.index] != 0) answer.add(loc);
    }
    return answer;
  }

  /**
   * Returns locations that have duplicate values for some unit, in row-major
   * order.
   */
  public Set<Location> getBrokenLocations() {
    Set<Location> answer = Sets.newTreeSet();
    for (Unit unit : Unit.allUnits()) {
      NumSet conflicts = unit.getConflicts(this);
      if (conflicts.isEmpty()) continue;
      for (Location loc : unit) {
        if ((getBit(loc) & conflicts.bits) != 0)
          answer.add(loc);
      }
    }
    return answer;
  }

  @Override public boolean equals(Object object) {
    if (this == object) return true;
    if (!(object instanceof Grid)) return false;
    Grid that = (Grid) object;
    return Arrays.equals(this.squares, that.squares);
  }

  @Override public int hashCode() {
    return Arrays.hashCode(squares);
  }

  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (Row row : Row.ALL) {
      for (Location loc : row) {
        if (squares[loc.index] > 0) sb.append(' ').append(squares[loc.index]);
        else sb.append(" .");
        if (loc.column.index + 1 == 3 || loc.column.index + 1 == 6)
          sb.append(" |");
      }
      sb.append('\n');
      if (row.index + 1 == 3 || row.index + 1 == 6)
        sb.append("-------+-------+-------\n");
    }
    return sb.toString();
  }

  /**
   * Generates a string of 81 characters with dots for empty locations and
   * digits for filled ones.
   */
  public String toFlatString() {
    StringBuilder sb = new StringBuilder();
    for (byte square : squares)
      sb.append(square == 0 ? '.' : (char) ('0' + square));
    return sb.toString();
  }

  /** Returns the grid as 9 rows of 9 values, 0 for empty. */
  public int[][] toRows() {
    int[][] rows = new int[9][9];
    for (Location loc : Location.ALL)
      rows[loc.row.index][loc.column.index] = squares[loc.index];
    return rows;
  }

  /**
   * Ignores all characters except digits and periods, requires there to be 81
   * total.  Zeros and periods are empty cells.
   */
  public static Grid fromString(String s) {
    byte[] squares = new byte[Location.COUNT];
    int index = 0;
    for (char c : s.toCharArray()) {
      if (c >= '0' && c <= '9' || c == '.') {
        checkArgument(index < Location.COUNT, "Too many cells in %s", s);
        squares[index++] = (byte) (c == '.' ? 0 : c - '0');
      }
    }
    checkArgument(index == Location.COUNT,
        "Grid.fromString requires 81 locations, got %s in %s", index, s);
    return new Grid(squares);
  }

  /**
   * Builds a grid from 9 rows of 9 values each, every value in 0..9.
   *
   * @throws IllegalArgumentException if the rows have the wrong shape
   * @throws InvalidValueException if a value is out of range
   */
  public static Grid fromRows(int[][] rows) {
    checkNotNull(rows, "rows");
    checkArgument(rows.length == 9, "Expected 9 rows, got %s", rows.length);
    byte[] squares = new byte[Location.COUNT];
    for (int r = 0; r < 9; ++r) {
      checkArgument(rows[r] != null && rows[r].length == 9,
          "Row %s must have 9 values", r);
      for (int c = 0; c < 9; ++c)
        squares[r * 9 + c] = (byte) Numeral.number(numeral(rows[r][c]));
    }
    return new Grid(squares);
  }
}
