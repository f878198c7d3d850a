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
package us.blanshard.sudokucsp.engine;

import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.sudokucsp.core.Grid;
import us.blanshard.sudokucsp.core.UnsatisfiableException;
import us.blanshard.sudokucsp.gen.Difficulty;
import us.blanshard.sudokucsp.gen.Generator;
import us.blanshard.sudokucsp.gen.Puzzle;
import us.blanshard.sudokucsp.insight.Hint;
import us.blanshard.sudokucsp.insight.Hinter;
import us.blanshard.sudokucsp.solver.Solver;

/**
 * The four operations the engine offers its callers: generate, solve, hint
 * and validate.  None of them modifies a grid passed in.  Grids are not
 * thread safe, so concurrent callers must each bring their own.
 */
public final class SudokuEngine {

  private final EngineConfig config;
  private final Generator generator;

  /** Creates an engine configured from the classpath, see {@link EngineConfig#load}. */
  public SudokuEngine() {
    this(EngineConfig.load());
  }

  public SudokuEngine(EngineConfig config) {
    this.config = checkNotNull(config);
    this.generator = new Generator(config.newRandom(), config.requireUniqueSolution());
  }

  public EngineConfig getConfig() {
    return config;
  }

  /** Generates a puzzle and its solution at the given difficulty. */
  public Puzzle generate(Difficulty difficulty) {
    return generator.generate(difficulty);
  }

  /** Generates a puzzle with up to the given number of cells, 0..81, cleared. */
  public Puzzle generate(int cellsToClear) {
    return generator.generate(cellsToClear);
  }

  /**
   * Returns a solution of the given puzzle.
   *
   * @throws UnsatisfiableException if the puzzle has none
   */
  public Grid solve(Grid puzzle) throws UnsatisfiableException {
    Grid grid = checkNotNull(puzzle).copy();
    Solver.Result result = Solver.solve(grid, config.propagate());
    if (!result.isSatisfiable())
      throw new UnsatisfiableException(puzzle, result.numSteps);
    return grid;
  }

  /**
   * Returns a solution of the given puzzle, given as 9 rows of 9 values.
   *
   * @throws IllegalArgumentException if the rows are malformed
   * @throws UnsatisfiableException if the puzzle has none
   */
  public int[][] solve(int[][] puzzle) throws UnsatisfiableException {
    return solve(Grid.fromRows(puzzle)).toRows();
  }

  /**
   * Suggests a value for the given empty cell, with the reasoning.
   *
   * @throws us.blanshard.sudokucsp.core.CellOccupiedException if the cell is filled
   */
  public Hint hint(Grid grid, int row, int col) {
    return Hinter.hint(checkNotNull(grid), row, col);
  }

  public Hint hint(int[][] grid, int row, int col) {
    return hint(Grid.fromRows(grid), row, col);
  }

  /**
   * Tells whether the grid is a win, still incomplete, or breaks the rules
   * somewhere.
   */
  public Grid.State validate(Grid grid) {
    return grid.getState();
  }

  public Grid.State validate(int[][] grid) {
    return validate(Grid.fromRows(grid));
  }
}
