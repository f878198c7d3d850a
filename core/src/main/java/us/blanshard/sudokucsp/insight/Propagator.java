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

import us.blanshard.sudokucsp.core.Constraints;
import us.blanshard.sudokucsp.core.Grid;
import us.blanshard.sudokucsp.core.Location;
import us.blanshard.sudokucsp.core.NumSet;
import us.blanshard.sudokucsp.core.Numeral;
import us.blanshard.sudokucsp.core.Unit;

import com.google.common.collect.Lists;

import java.util.List;
import java.util.logging.Logger;

import javax.annotation.Nullable;

/**
 * Deduces forced values without guessing: naked singles (a cell with one
 * candidate) and hidden singles (a value with one possible cell in a unit).
 *
 * <p> Forced values are facts about one grid state.  Placing one can create or
 * destroy others, so {@link #propagate} re-derives them after every round
 * until nothing more is forced.
 */
public final class Propagator {
  private static final Logger logger = Logger.getLogger(Propagator.class.getName());

  private Propagator() {}

  /**
   * Returns every empty cell whose candidate set has exactly one member, in
   * row-major order.
   */
  public static List<ForcedNum> findNakedSingles(Grid grid) {
    List<ForcedNum> answer = Lists.newArrayList();
    for (Location loc : grid.getEmptyLocations()) {
      NumSet candidates = Constraints.candidates(grid, loc);
      if (candidates.size() == 1)
        answer.add(new ForcedNum(loc, candidates.first()));
    }
    return answer;
  }

  /**
   * Returns, for each unit (rows, then columns, then blocks) and each value
   * missing from it, the single cell of the unit where the value is still a
   * candidate, when there is exactly one.  A cell may appear once per unit
   * that forces it.
   */
  public static List<ForcedLoc> findHiddenSingles(Grid grid) {
    List<ForcedLoc> answer = Lists.newArrayList();
    NumSet[] candidates = candidatesByLocation(grid);
    for (Unit unit : Unit.allUnits()) {
      for (Numeral num : unit.getMissing(grid)) {
        Location only = onlyLocation(unit, num, candidates);
        if (only != null)
          answer.add(new ForcedLoc(unit, num, only));
      }
    }
    return answer;
  }

  /**
   * Places forced values in the grid until none remain, appending each
   * location it fills to the given trail.  Returns false if it finds a
   * contradiction: an empty cell with no candidates, a value that has no
   * possible cell in a unit missing it, or two forced values that cannot
   * both hold.  Cells placed before the contradiction are left in place and
   * recorded in the trail, for the caller to {@link #revert}.
   */
  public static boolean propagate(Grid grid, List<Location> trail) {
    int[] forced = new int[Location.COUNT];
    while (true) {
      NumSet[] candidates = candidatesByLocation(grid);
      boolean found = false;
      for (Location loc : Location.ALL) {
        forced[loc.index] = 0;
        NumSet set = candidates[loc.index];
        if (set == null) continue;
        if (set.isEmpty()) {
          logger.finest("no candidates left at " + loc);
          return false;
        }
        if (set.size() == 1) {
          forced[loc.index] = set.bits;
          found = true;
        }
      }

      for (Unit unit : Unit.allUnits()) {
        for (Numeral num : unit.getMissing(grid)) {
          int count = 0;
          Location only = null;
          for (Location loc : unit) {
            NumSet set = candidates[loc.index];
            if (set != null && set.contains(num)) {
              ++count;
              only = loc;
            }
          }
          if (count == 0) {
            logger.finest("no place for " + num + " in " + unit);
            return false;
          }
          if (count == 1) {
            int prev = forced[only.index];
            if (prev != 0 && prev != num.bit) {
              logger.finest("two forced values at " + only);
              return false;
            }
            forced[only.index] = num.bit;
            found = true;
          }
        }
      }

      if (!found) return true;

      for (Location loc : Location.ALL) {
        if (forced[loc.index] == 0) continue;
        Numeral num = NumSet.ofBits(forced[loc.index]).first();
        if (grid.violatesConstraints(loc, num)) {
          logger.finest("forced " + num + " collides at " + loc);
          return false;
        }
        grid.set(loc, num);
        trail.add(loc);
      }
    }
  }

  /**
   * Empties every location appended to the trail after the given mark, and
   * truncates the trail back to the mark.
   */
  public static void revert(Grid grid, List<Location> trail, int mark) {
    for (int i = trail.size(); i-- > mark; ) {
      grid.clear(trail.remove(i));
    }
  }

  /** Returns the candidates of each empty location, null for filled ones. */
  private static NumSet[] candidatesByLocation(Grid grid) {
    NumSet[] answer = new NumSet[Location.COUNT];
    for (Location loc : grid.getEmptyLocations())
      answer[loc.index] = Constraints.candidates(grid, loc);
    return answer;
  }

  @Nullable private static Location onlyLocation(Unit unit, Numeral num, NumSet[] candidates) {
    Location only = null;
    for (Location loc : unit) {
      NumSet set = candidates[loc.index];
      if (set != null && set.contains(num)) {
        if (only != null) return null;
        only = loc;
      }
    }
    return only;
  }
}
