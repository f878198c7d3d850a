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
package us.blanshard.sudokucsp.solver;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.sudokucsp.core.Constraints;
import us.blanshard.sudokucsp.core.Grid;
import us.blanshard.sudokucsp.core.Location;
import us.blanshard.sudokucsp.core.NumSet;
import us.blanshard.sudokucsp.core.Numeral;
import us.blanshard.sudokucsp.insight.Propagator;

import com.google.common.collect.Lists;

import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A depth-first backtracking Sudoku solver.  It works in place on the grid
 * it is given: each guess is written into the grid and erased again if it
 * leads nowhere.  On return the grid is either solved or exactly as it was on
 * entry.
 *
 * <p> The next cell to guess is the empty cell with the fewest candidates,
 * ties going to the first in row-major order.  Before each guess the solver
 * may run the {@link Propagator} to commit forced values; those are erased
 * along with the guess on backtrack.
 *
 * <p> In solve mode candidates are tried in increasing order, so the result
 * is deterministic.  In fill mode they are tried in an order shuffled by the
 * given {@link Random}, which yields varied complete grids from an empty one.
 */
@NotThreadSafe
public final class Solver {
  private static final Logger logger = Logger.getLogger(Solver.class.getName());

  /**
   * Solves the given grid in place, propagating forced values before each
   * guess.  Returns a summary of the result.
   */
  public static Result solve(Grid grid) {
    return solve(grid, true);
  }

  /**
   * Solves the given grid in place, with or without propagation before each
   * guess.  Returns a summary of the result.
   */
  public static Result solve(Grid grid, boolean propagate) {
    return new Solver(grid, null, propagate).run();
  }

  /**
   * Completes the given grid in place, trying candidates in an order chosen by
   * the given random.  Normally called on an empty grid to make a random
   * solution.
   */
  public static Result fill(Grid grid, Random random) {
    return new Solver(grid, checkNotNull(random), true).run();
  }

  /**
   * Counts the solutions of the given grid, stopping once the count reaches
   * the given limit.  The grid is not modified.
   */
  public static int countSolutions(Grid grid, int limit) {
    checkArgument(limit > 0, "limit must be positive: %s", limit);
    Solver solver = new Solver(grid.copy(), null, true);
    if (!solver.grid.getBrokenLocations().isEmpty()) return 0;
    solver.search(new Counter(limit));
    return solver.solutionCount;
  }

  /**
   * A summary of a solver's work.
   */
  @Immutable
  public static final class Result {
    private final Grid start;
    @Nullable private final Grid solution;
    public final int numSteps;  // The number of guesses tried

    private Result(Grid start, @Nullable Grid solution, int numSteps) {
      this.start = start;
      this.solution = solution;
      this.numSteps = numSteps;
    }

    /** Tells whether a solution was found. */
    public boolean isSatisfiable() {
      return solution != null;
    }

    /** Returns a copy of the grid the solver started from. */
    public Grid getStart() {
      return start.copy();
    }

    /** Returns a copy of the solution, or null if there was none. */
    @Nullable public Grid getSolution() {
      return solution == null ? null : solution.copy();
    }

    @Override public String toString() {
      return (isSatisfiable() ? "solved" : "unsatisfiable") + " in " + numSteps + " steps";
    }
  }

  private final Grid grid;
  @Nullable private final Random random;
  private final boolean propagate;
  private final List<Location> trail = Lists.newArrayList();
  private int numSteps;
  private int solutionCount;

  private Solver(Grid grid, @Nullable Random random, boolean propagate) {
    this.grid = checkNotNull(grid);
    this.random = random;
    this.propagate = propagate;
  }

  private Result run() {
    Grid start = grid.copy();
    boolean solved = grid.getBrokenLocations().isEmpty() && search(FIRST_SOLUTION);
    logger.fine((solved ? "Solved " : "No solution for ") + start.toFlatString()
        + " in " + numSteps + " steps");
    return new Result(start, solved ? grid.copy() : null, numSteps);
  }

  /** Decides whether the search stops at a solution it has reached. */
  private interface SolutionHandler {
    boolean stopAt(Solver solver);
  }

  private static final SolutionHandler FIRST_SOLUTION = new SolutionHandler() {
    @Override public boolean stopAt(Solver solver) {
      ++solver.solutionCount;
      return true;
    }
  };

  private static class Counter implements SolutionHandler {
    private final int limit;
    Counter(int limit) {
      this.limit = limit;
    }
    @Override public boolean stopAt(Solver solver) {
      return ++solver.solutionCount >= limit;
    }
  }

  /**
   * Searches for solutions below the current grid state.  Returns true if the
   * handler stopped the search at a solution, which is then left in the grid.
   * Otherwise the grid is restored and false is returned.
   */
  private boolean search(SolutionHandler handler) {
    int mark = trail.size();
    if (propagate && !Propagator.propagate(grid, trail)) {
      Propagator.revert(grid, trail, mark);
      return false;
    }

    Location loc = chooseLocation();
    if (loc == null) {
      if (handler.stopAt(this)) return true;
      Propagator.revert(grid, trail, mark);
      return false;
    }

    for (Numeral num : order(Constraints.candidates(grid, loc))) {
      ++numSteps;
      grid.set(loc, num);
      if (search(handler)) return true;
      grid.clear(loc);
    }
    Propagator.revert(grid, trail, mark);
    return false;
  }

  /**
   * Returns the empty location with the fewest candidates, the first such in
   * row-major order, or null if the grid is full.  A location with no
   * candidates is returned as soon as it is seen.
   */
  @Nullable private Location chooseLocation() {
    Location best = null;
    int bestSize = Numeral.COUNT + 1;
    for (Location loc : grid.getEmptyLocations()) {
      int size = Constraints.candidates(grid, loc).size();
      if (size == 0) return loc;
      if (size < bestSize) {
        best = loc;
        bestSize = size;
      }
    }
    return best;
  }

  private Iterable<Numeral> order(NumSet candidates) {
    if (random == null || candidates.size() < 2) return candidates;
    List<Numeral> nums = Lists.newArrayList(candidates);
    Collections.shuffle(nums, random);
    return nums;
  }
}
