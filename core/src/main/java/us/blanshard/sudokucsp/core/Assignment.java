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

import static com.google.common.base.Preconditions.checkNotNull;

import javax.annotation.concurrent.Immutable;

/**
 * A value placed in a cell: the (row, column, value) triple.  Interned, so
 * instances may be compared by identity.
 */
@Immutable
public final class Assignment {

  public final Location location;
  public final Numeral numeral;

  public static Assignment of(Location location, Numeral numeral) {
    return INSTANCES[index(location, numeral)];
  }

  /** Returns the assignment of the given value, 1..9, at the given 0-based cell. */
  public static Assignment of(int row, int col, int value) {
    return of(Location.of(row, col), Numeral.of(value));
  }

  public int row() {
    return location.row.index;
  }

  public int col() {
    return location.column.index;
  }

  public int value() {
    return numeral.number;
  }

  private Assignment(Location location, Numeral numeral) {
    this.location = checkNotNull(location);
    this.numeral = checkNotNull(numeral);
  }

  @Override public String toString() {
    return location + " \u2190 " + numeral.number;  // left arrow
  }

  private static final Assignment[] INSTANCES;
  static {
    INSTANCES = new Assignment[Location.COUNT * Numeral.COUNT];
    for (Location loc : Location.ALL)
      for (Numeral num : Numeral.ALL)
        INSTANCES[index(loc, num)] = new Assignment(loc, num);
  }

  private static int index(Location location, Numeral numeral) {
    return location.index * Numeral.COUNT + numeral.index;
  }
}
