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

import com.google.common.collect.Maps;

import java.util.Map;

/**
 * Computes the legal values for cells of a grid.  Every answer is derived
 * from the grid's current contents; nothing is cached, because the grid
 * changes between calls.
 */
public final class Constraints {

  private Constraints() {}

  /**
   * Returns the candidates for the given cell: empty if the cell is filled,
   * otherwise 1..9 minus the values in the cell's row, column and box.
   */
  public static NumSet candidates(Grid grid, int row, int col) {
    return candidates(grid, Location.of(row, col));
  }

  public static NumSet candidates(Grid grid, Location loc) {
    if (!grid.isEmpty(loc)) return NumSet.NONE;
    return grid.getPeerValues(loc).not();
  }

  /**
   * Tells whether the given value is a candidate for the given cell, without
   * enumerating the whole candidate set.
   *
   * @throws InvalidValueException if value is outside 1..9
   */
  public static boolean isValidPlacement(Grid grid, int row, int col, int value) {
    return isValidPlacement(grid, Location.of(row, col), Numeral.of(value));
  }

  public static boolean isValidPlacement(Grid grid, Location loc, Numeral num) {
    return grid.isEmpty(loc) && !grid.violatesConstraints(loc, num);
  }

  /**
   * Returns the candidates of every empty cell, in row-major order.  Cells
   * with no candidates are included, mapped to the empty set.
   */
  public static Map<Location, NumSet> allCandidates(Grid grid) {
    Map<Location, NumSet> answer = Maps.newLinkedHashMap();
    for (Location loc : grid.getEmptyLocations())
      answer.put(loc, candidates(grid, loc));
    return answer;
  }
}
