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
package us.blanshard.sudokucsp.gen;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.sudokucsp.core.Grid;
import us.blanshard.sudokucsp.core.Location;
import us.blanshard.sudokucsp.core.Numeral;
import us.blanshard.sudokucsp.solver.Solver;

import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Generates Sudoku puzzles.  The solution comes first: a random complete grid
 * made by the solver in fill mode.  The puzzle is then cut from it by
 * clearing cells chosen at random, so it always has at least that solution.
 *
 * <p> By default the puzzle may have other solutions too.  When asked to
 * require a unique solution, the generator counts solutions after each
 * clearing and puts the clue back if there is more than one.
 */
public final class Generator {
  private static final Logger logger = Logger.getLogger(Generator.class.getName());

  private final Random random;
  private final boolean requireUniqueSolution;

  public Generator(Random random) {
    this(random, false);
  }

  public Generator(Random random, boolean requireUniqueSolution) {
    this.random = checkNotNull(random);
    this.requireUniqueSolution = requireUniqueSolution;
  }

  /** Generates a puzzle for the given difficulty tier. */
  public Puzzle generate(Difficulty difficulty) {
    return generate(difficulty.getCellsToClear());
  }

  /** Generates a puzzle with up to the given number of cells cleared. */
  public Puzzle generate(int cellsToClear) {
    checkArgument(cellsToClear >= 0 && cellsToClear <= Location.COUNT,
        "cells to clear must be in 0..81: %s", cellsToClear);
    Grid solution = makeTarget(random);
    Grid puzzle = solution.copy();
    int cleared = clear(puzzle, cellsToClear);
    logger.fine("Cleared " + cleared + " of " + cellsToClear + " cells: " + puzzle.toFlatString());
    return new Puzzle(puzzle, solution);
  }

  /** Creates a completely solved grid. */
  public static Grid makeTarget(Random random) {
    Grid grid = new Grid();
    Solver.Result result = Solver.fill(grid, random);
    if (!result.isSatisfiable())
      throw new AssertionError("An empty grid always has a solution");
    return grid;
  }

  /** Returns all locations in random order. */
  public static List<Location> randomLocations(Random random) {
    List<Location> locs = Lists.newArrayList(Location.ALL);
    Collections.shuffle(locs, random);
    return locs;
  }

  /**
   * Clears filled cells of the grid in random order until the target count is
   * reached or no cell is left to try.  Returns the number cleared.
   */
  private int clear(Grid grid, int target) {
    int cleared = 0;
    for (Location loc : randomLocations(random)) {
      if (cleared >= target) break;
      Numeral clue = grid.get(loc);
      if (clue == null) continue;
      grid.clear(loc);
      if (requireUniqueSolution && Solver.countSolutions(grid, 2) != 1) {
        grid.set(loc, clue);
        continue;
      }
      ++cleared;
    }
    return cleared;
  }
}
