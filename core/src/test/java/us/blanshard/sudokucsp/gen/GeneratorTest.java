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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import us.blanshard.sudokucsp.core.Grid;
import us.blanshard.sudokucsp.core.Location;
import us.blanshard.sudokucsp.solver.Solver;

import com.google.common.collect.Sets;

import org.junit.Test;

import java.util.Random;

public class GeneratorTest {

  @Test public void everyTierYieldsAConsistentPair() {
    Generator generator = new Generator(new Random(2013));
    for (Difficulty difficulty : Difficulty.values()) {
      Puzzle puzzle = generator.generate(difficulty);
      Grid solution = puzzle.getSolution();
      Grid clues = puzzle.getPuzzle();
      assertTrue(solution.isComplete());
      assertEquals(Grid.State.WIN, solution.getState());
      for (Location loc : clues.getFilledLocations())
        assertEquals(solution.get(loc), clues.get(loc));
      assertEquals(difficulty.getCellsToClear(), puzzle.getCellsCleared());
      assertEquals(81 - difficulty.getCellsToClear(), puzzle.getClueCount());
    }
  }

  @Test public void generatedPuzzlesAreSolvable() {
    Generator generator = new Generator(new Random(7));
    for (int i = 0; i < 5; ++i) {
      Grid grid = generator.generate(Difficulty.EXTREME).getPuzzle();
      assertTrue(Solver.solve(grid).isSatisfiable());
      assertEquals(Grid.State.WIN, grid.getState());
    }
  }

  @Test public void sameSeedSamePuzzle() {
    Puzzle a = new Generator(new Random(99)).generate(Difficulty.HARD);
    Puzzle b = new Generator(new Random(99)).generate(Difficulty.HARD);
    assertEquals(a, b);
    assertNotEquals(a, new Generator(new Random(100)).generate(Difficulty.HARD));
  }

  @Test public void extremeCounts() {
    Generator generator = new Generator(new Random(5));
    Puzzle none = generator.generate(0);
    assertEquals(none.getSolution(), none.getPuzzle());
    Puzzle all = generator.generate(81);
    assertEquals(new Grid(), all.getPuzzle());
    assertEquals(Grid.State.WIN, all.getSolution().getState());
  }

  @Test(expected = IllegalArgumentException.class)
  public void tooManyCells() {
    new Generator(new Random()).generate(82);
  }

  @Test public void uniqueSolutionOnRequest() {
    Generator generator = new Generator(new Random(31), true);
    Puzzle puzzle = generator.generate(Difficulty.INTERMEDIATE);
    assertEquals(1, Solver.countSolutions(puzzle.getPuzzle(), 2));
    assertTrue(puzzle.getCellsCleared() <= Difficulty.INTERMEDIATE.getCellsToClear());
    Grid grid = puzzle.getPuzzle();
    Solver.solve(grid);
    assertEquals(puzzle.getSolution(), grid);
  }

  @Test public void randomLocationsIsAPermutation() {
    assertEquals(Sets.newHashSet(Location.ALL),
                 Sets.newHashSet(Generator.randomLocations(new Random(3))));
    assertEquals(81, Generator.randomLocations(new Random(3)).size());
  }
}
