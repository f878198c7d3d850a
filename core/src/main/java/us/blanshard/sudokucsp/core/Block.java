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

import com.google.common.collect.ImmutableList;

import javax.annotation.concurrent.Immutable;

/**
 * One 3x3 block (box) of the grid, indexed 0 to 8 in reading order.  A
 * cell's block index is {@code (row / 3) * 3 + col / 3}.
 */
@Immutable
public final class Block extends Unit {

  /** All the blocks, in index order. */
  public static final ImmutableList<Block> ALL;

  /** The index, 0..8. */
  public final int index;

  public static Block ofIndex(int index) {
    return ALL.get(index);
  }

  /** Returns the block holding the cell at the given row and column indices. */
  public static Block containing(int row, int col) {
    return ofIndex(row / 3 * 3 + col / 3);
  }

  @Override public Type getType() {
    return Type.BLOCK;
  }

  @Override public String toString() {
    return "Box " + (index + 1);
  }

  private Block(int index) {
    this.index = index;
    for (int i = 0; i < 9; ++i)
      locations[i] = (byte) (index / 3 * 27 + index % 3 * 3 + i / 3 * 9 + i % 3);
  }

  static {
    ImmutableList.Builder<Block> builder = ImmutableList.builder();
    for (int i = 0; i < 9; ++i)
      builder.add(new Block(i));
    ALL = builder.build();
  }
}
