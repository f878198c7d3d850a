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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static us.blanshard.sudokucsp.core.TestHelper.l;

import com.google.common.collect.Sets;

import org.junit.Test;

import java.util.Set;

public class LocationTest {

  @Test public void all() {
    assertEquals(81, Location.ALL.size());
    int index = 0;
    for (Location loc : Location.ALL) {
      assertEquals(index, loc.index);
      assertEquals(index / 9, loc.row.index);
      assertEquals(index % 9, loc.column.index);
      assertSame(loc, Location.of(loc.row.index, loc.column.index));
      assertSame(loc, Location.of(loc.row, loc.column));
      ++index;
    }
  }

  @Test public void block() {
    assertEquals(0, l(0, 0).block.index);
    assertEquals(0, l(2, 2).block.index);
    assertEquals(4, l(4, 4).block.index);
    assertEquals(5, l(3, 8).block.index);
    assertEquals(6, l(8, 0).block.index);
    assertEquals(8, l(8, 8).block.index);
    for (Location loc : Location.ALL)
      assertEquals((loc.row.index / 3) * 3 + loc.column.index / 3, loc.block.index);
  }

  @Test public void units() {
    Location loc = l(4, 7);
    assertThat(loc.units).containsExactly(loc.row, loc.column, loc.block).inOrder();
    assertSame(loc.row, loc.unit(Unit.Type.ROW));
    assertSame(loc.column, loc.unit(Unit.Type.COLUMN));
    assertSame(loc.block, loc.unit(Unit.Type.BLOCK));
  }

  @Test public void peers() {
    for (Location loc : Location.ALL) {
      assertEquals(20, loc.peers.size());
      Set<Location> expected = Sets.newHashSet();
      for (Unit unit : loc.units)
        expected.addAll(unit);
      expected.remove(loc);
      assertThat(loc.peers).containsExactlyElementsIn(expected);
    }
  }

  @Test public void display() {
    assertEquals("(1, 1)", l(0, 0).toString());
    assertEquals("(5, 9)", l(4, 8).toString());
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void rowOutOfRange() {
    Location.of(9, 0);
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void columnOutOfRange() {
    Location.of(0, -1);
  }
}
