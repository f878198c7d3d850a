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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static us.blanshard.sudokucsp.core.TestHelper.PUZZLE;
import static us.blanshard.sudokucsp.core.TestHelper.SOLUTION;
import static us.blanshard.sudokucsp.core.TestHelper.a;
import static us.blanshard.sudokucsp.core.TestHelper.g;
import static us.blanshard.sudokucsp.core.TestHelper.l;
import static us.blanshard.sudokucsp.core.TestHelper.n;

import us.blanshard.sudokucsp.core.Assignment;
import us.blanshard.sudokucsp.core.Constraints;
import us.blanshard.sudokucsp.core.Grid;
import us.blanshard.sudokucsp.core.Location;
import us.blanshard.sudokucsp.core.Numeral;
import us.blanshard.sudokucsp.core.Row;

import com.google.common.collect.Lists;

import org.junit.Test;

import java.util.List;

public class PropagatorTest {

  @Test public void nakedSingles() {
    List<ForcedNum> singles = Propagator.findNakedSingles(g(PUZZLE));
    assertThat(singles).containsExactly(
        new ForcedNum(l(4, 4), n(5)),
        new ForcedNum(l(6, 5), n(7)),
        new ForcedNum(l(6, 8), n(4)),
        new ForcedNum(l(7, 7), n(3))).inOrder();
    assertEquals(a(4, 4, 5), singles.get(0).getAssignment());
  }

  @Test public void nakedSinglesAreSound() {
    Grid grid = g(PUZZLE);
    for (ForcedNum single : Propagator.findNakedSingles(grid)) {
      Assignment assignment = single.getAssignment();
      assertFalse(grid.violatesConstraints(assignment.row(), assignment.col(), assignment.value()));
      for (Numeral num : Numeral.ALL) {
        assertEquals(num == assignment.numeral,
                     Constraints.isValidPlacement(grid, assignment.location, num));
      }
      assertTrue(single.isImpliedBy(grid));
    }
  }

  @Test public void hiddenSingles() {
    Grid grid = g(PUZZLE);
    List<ForcedLoc> singles = Propagator.findHiddenSingles(grid);
    assertEquals(new ForcedLoc(Row.ofIndex(2), n(5), l(2, 6)), singles.get(0));
    for (ForcedLoc single : singles) {
      assertTrue(single.isImpliedBy(grid));
      assertTrue(single.getUnit().contains(single.getLocation()));
      int places = 0;
      for (Location loc : single.getUnit()) {
        if (Constraints.isValidPlacement(grid, loc, single.getNumeral())) ++places;
      }
      assertEquals(1, places);
    }
  }

  @Test public void hiddenSingleNoLongerImpliedOnceFilled() {
    Grid grid = g(PUZZLE);
    ForcedLoc single = new ForcedLoc(Row.ofIndex(2), n(5), l(2, 6));
    single.apply(grid);
    assertEquals(5, grid.get(2, 6));
    assertFalse(single.isImpliedBy(grid));
  }

  @Test public void propagateToSolution() {
    Grid grid = g(PUZZLE);
    List<Location> trail = Lists.newArrayList();
    assertTrue(Propagator.propagate(grid, trail));
    assertEquals(g(SOLUTION), grid);
    assertEquals(51, trail.size());
    assertThat(trail).containsNoDuplicates();
  }

  @Test public void revertRestoresExactly() {
    Grid grid = g(PUZZLE);
    List<Location> trail = Lists.newArrayList();
    trail.add(l(0, 0));  // Something committed before the mark
    Propagator.propagate(grid, trail);
    Propagator.revert(grid, trail, 1);
    assertEquals(g(PUZZLE), grid);
    assertThat(trail).containsExactly(l(0, 0));
  }

  @Test public void propagateStopsWhenNothingIsForced() {
    Grid grid = new Grid().set(0, 0, 1).set(4, 4, 2);
    Grid before = grid.copy();
    List<Location> trail = Lists.newArrayList();
    assertTrue(Propagator.propagate(grid, trail));
    assertThat(trail).isEmpty();
    assertEquals(before, grid);
  }

  @Test public void contradictionWhenCellHasNoCandidates() {
    Grid grid = g(
        " 1 2 3 | 4 5 6 | 7 8 . " +
        " . . . | . . . | . . 9 " +
        " . . . | . . . | . . . " +
        "-------+-------+-------" +
        " . . . | . . . | . . . " +
        " . . . | . . . | . . . " +
        " . . . | . . . | . . . " +
        "-------+-------+-------" +
        " . . . | . . . | . . . " +
        " . . . | . . . | . . . " +
        " . . . | . . . | . . . ");
    List<Location> trail = Lists.newArrayList();
    assertFalse(Propagator.propagate(grid, trail));
    assertThat(trail).isEmpty();
  }

  @Test public void contradictionWhenValueHasNoPlace() {
    Grid grid = g(
        " 2 3 4 | 5 6 7 | 8 . . " +
        " . . . | . . . | . . . " +
        " . . . | . . . | . . . " +
        "-------+-------+-------" +
        " . . . | . . . | . . . " +
        " . . . | . . . | . . . " +
        " . . . | . . . | . 1 . " +
        "-------+-------+-------" +
        " . . . | . . . | . . 1 " +
        " . . . | . . . | . . . " +
        " . . . | . . . | . . . ");
    List<Location> trail = Lists.newArrayList();
    assertFalse(Propagator.propagate(grid, trail));
    Propagator.revert(grid, trail, 0);
    assertEquals(0, grid.get(0, 7));
    assertEquals(0, grid.get(0, 8));
  }
}
