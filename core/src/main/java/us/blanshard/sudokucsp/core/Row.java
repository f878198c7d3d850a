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
 * One row of the grid, indexed 0 to 8 from the top.
 */
@Immutable
public final class Row extends Unit {

  /** All the rows, in index order. */
  public static final ImmutableList<Row> ALL;

  /** The index, 0..8. */
  public final int index;

  public static Row ofIndex(int index) {
    return ALL.get(index);
  }

  @Override public Type getType() {
    return Type.ROW;
  }

  @Override public String toString() {
    return "Row " + (index + 1);
  }

  private Row(int index) {
    this.index = index;
    for (int i = 0; i < 9; ++i)
      locations[i] = (byte) (index * 9 + i);
  }

  static {
    ImmutableList.Builder<Row> builder = ImmutableList.builder();
    for (int i = 0; i < 9; ++i)
      builder.add(new Row(i));
    ALL = builder.build();
  }
}
