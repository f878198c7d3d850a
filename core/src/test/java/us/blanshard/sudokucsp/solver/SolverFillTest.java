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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import us.blanshard.sudokucsp.core.Grid;

import org.junit.Test;

import java.util.Random;

public class SolverFillTest {

  @Test public void fillMakesASolvedGrid() {
    for (long seed = 0; seed < 10; ++seed) {
      Grid grid = new Grid();
      Solver.Result result = Solver.fill(grid, new Random(seed));
      assertTrue(result.isSatisfiable());
      assertEquals(Grid.State.WIN, grid.getState());
    }
  }

  @Test public void sameSeedSameGrid() {
    Grid a = new Grid();
    Grid b = new Grid();
    Solver.fill(a, new Random(42));
    Solver.fill(b, new Random(42));
    assertEquals(a, b);
  }

  @Test public void differentSeedsVary() {
    Grid a = new Grid();
    Grid b = new Grid();
    Solver.fill(a, new Random(1));
    Solver.fill(b, new Random(2));
    assertNotEquals(a, b);
  }

  @Test public void fillKeepsExistingValues() {
    Grid grid = new Grid().set(0, 0, 9).set(8, 8, 1).set(4, 4, 5);
    assertTrue(Solver.fill(grid, new Random(3)).isSatisfiable());
    assertEquals(9, grid.get(0, 0));
    assertEquals(1, grid.get(8, 8));
    assertEquals(5, grid.get(4, 4));
    assertEquals(Grid.State.WIN, grid.getState());
  }

  @Test public void duplicateInRowIsUnsatisfiable() {
    Grid grid = new Grid().set(2, 0, 4).set(2, 7, 4);
    Grid before = grid.copy();
    Solver.Result result = Solver.solve(grid);
    assertFalse(result.isSatisfiable());
    assertEquals(0, result.numSteps);
    assertEquals(before, grid);
    assertFalse(Solver.fill(grid, new Random(1)).isSatisfiable());
    assertEquals(before, grid);
  }

  @Test public void emptyGridTakesSmallestValuesFirst() {
    Grid a = new Grid();
    Grid b = new Grid();
    Solver.solve(a);
    Solver.solve(b, false);
    assertEquals(Grid.State.WIN, a.getState());
    assertEquals(Grid.State.WIN, b.getState());
    assertEquals(1, a.get(0, 0));
    assertEquals(1, b.get(0, 0));
    Grid c = new Grid();
    Solver.solve(c);
    assertEquals(a, c);
  }
}
