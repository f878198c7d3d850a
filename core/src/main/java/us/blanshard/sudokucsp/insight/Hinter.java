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

import us.blanshard.sudokucsp.core.CellOccupiedException;
import us.blanshard.sudokucsp.core.Constraints;
import us.blanshard.sudokucsp.core.Grid;
import us.blanshard.sudokucsp.core.Location;
import us.blanshard.sudokucsp.core.NumSet;
import us.blanshard.sudokucsp.core.Numeral;
import us.blanshard.sudokucsp.core.Unit;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import javax.annotation.Nullable;

/**
 * Answers "what can go in this cell, and why" without revealing the solution.
 * Every method is a pure read of the grid.
 */
public final class Hinter {

  private Hinter() {}

  /**
   * Suggests a value for the given empty cell: its naked single or hidden
   * single if it has one, otherwise its smallest candidate.
   *
   * @throws CellOccupiedException if the cell is filled
   */
  public static Hint hint(Grid grid, int row, int col) {
    return hint(grid, Location.of(row, col));
  }

  public static Hint hint(Grid grid, Location loc) {
    Explanation explanation = explain(grid, loc);
    NumSet candidates = explanation.getCandidates();
    if (candidates.isEmpty())
      return new Hint(loc, 0, Hint.Kind.NONE, null, explanation);

    if (candidates.size() == 1) {
      Numeral num = candidates.first();
      return new Hint(loc, num.number, Hint.Kind.NAKED_SINGLE, new ForcedNum(loc, num), explanation);
    }

    ForcedLoc hidden = findHiddenSingle(grid, loc, candidates);
    if (hidden != null)
      return new Hint(loc, hidden.getNumeral().number, Hint.Kind.HIDDEN_SINGLE, hidden, explanation);

    return new Hint(loc, candidates.first().number, Hint.Kind.GUESS, null, explanation);
  }

  /**
   * Reports which values the given empty cell's row, column and box exclude.
   *
   * @throws CellOccupiedException if the cell is filled
   */
  public static Explanation explain(Grid grid, int row, int col) {
    return explain(grid, Location.of(row, col));
  }

  public static Explanation explain(Grid grid, Location loc) {
    Numeral occupant = grid.get(loc);
    if (occupant != null)
      throw new CellOccupiedException(loc, occupant);
    return new Explanation(loc, loc.row.getValues(grid), loc.column.getValues(grid),
        loc.block.getValues(grid));
  }

  /**
   * Returns the empty cells that have at least one candidate, most constrained
   * first, ties in row-major order.
   */
  public static List<Location> rankLocations(Grid grid) {
    final int[] sizes = new int[Location.COUNT];
    List<Location> answer = Lists.newArrayList();
    for (Location loc : grid.getEmptyLocations()) {
      int size = Constraints.candidates(grid, loc).size();
      if (size > 0) {
        sizes[loc.index] = size;
        answer.add(loc);
      }
    }
    Collections.sort(answer, new Comparator<Location>() {
      @Override public int compare(Location a, Location b) {
        return ComparisonChain.start()
            .compare(sizes[a.index], sizes[b.index])
            .compare(a, b)
            .result();
      }
    });
    return answer;
  }

  /**
   * Returns the empty cell with the fewest (but not zero) candidates, or null
   * if there is none.
   */
  @Nullable public static Location bestLocation(Grid grid) {
    List<Location> ranked = rankLocations(grid);
    return ranked.isEmpty() ? null : ranked.get(0);
  }

  /**
   * Returns the first forced value anywhere in the grid: a naked single in
   * row-major order, otherwise a hidden single in unit order.  Returns null if
   * nothing is forced.
   */
  @Nullable public static Insight nextForced(Grid grid) {
    List<ForcedNum> naked = Propagator.findNakedSingles(grid);
    if (!naked.isEmpty()) return naked.get(0);
    List<ForcedLoc> hidden = Propagator.findHiddenSingles(grid);
    return hidden.isEmpty() ? null : hidden.get(0);
  }

  /**
   * Looks in the location's row, column and block, in that order, for a
   * candidate that has no other place in the unit.
   */
  @Nullable private static ForcedLoc findHiddenSingle(Grid grid, Location loc, NumSet candidates) {
    for (Unit unit : loc.units) {
      for (Numeral num : candidates) {
        boolean alone = true;
        for (Location other : unit) {
          if (other != loc && Constraints.isValidPlacement(grid, other, num)) {
            alone = false;
            break;
          }
        }
        if (alone) return new ForcedLoc(unit, num, loc);
      }
    }
    return null;
  }
}
