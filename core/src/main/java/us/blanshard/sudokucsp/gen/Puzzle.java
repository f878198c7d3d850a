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

import com.google.common.base.Objects;

import javax.annotation.concurrent.Immutable;

/**
 * A puzzle together with the solution it was cut from.  Every clue of the
 * puzzle matches the solution.  The grids are held privately; accessors
 * return copies.
 */
@Immutable
public final class Puzzle {
  private final Grid puzzle;
  private final Grid solution;

  /**
   * @throws IllegalArgumentException if the solution is not a win, or some
   *     clue of the puzzle disagrees with it
   */
  public Puzzle(Grid puzzle, Grid solution) {
    checkArgument(solution.getState() == Grid.State.WIN, "Solution is not solved:\n%s", solution);
    for (Location loc : checkNotNull(puzzle).getFilledLocations()) {
      checkArgument(puzzle.get(loc) == solution.get(loc),
          "Clue at %s disagrees with the solution", loc);
    }
    this.puzzle = puzzle.copy();
    this.solution = solution.copy();
  }

  /** Returns a copy of the puzzle grid, with zeros for the cleared cells. */
  public Grid getPuzzle() {
    return puzzle.copy();
  }

  /** Returns a copy of the complete solution grid. */
  public Grid getSolution() {
    return solution.copy();
  }

  /** The number of clues: filled cells of the puzzle. */
  public int getClueCount() {
    return puzzle.size();
  }

  /** The number of cells cleared from the solution. */
  public int getCellsCleared() {
    return Location.COUNT - puzzle.size();
  }

  /** Returns the solution's value at the given cell. */
  public int getSolutionValue(int row, int col) {
    return solution.get(row, col);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Puzzle)) return false;
    Puzzle that = (Puzzle) o;
    return this.puzzle.equals(that.puzzle) && this.solution.equals(that.solution);
  }

  @Override public int hashCode() {
    return Objects.hashCode(puzzle, solution);
  }

  @Override public String toString() {
    return puzzle.toFlatString() + " / " + solution.toFlatString();
  }
}
