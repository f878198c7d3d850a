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
 * One column of the grid, indexed 0 to 8 from the left.
 */
@Immutable
public final class Column extends Unit {

  /** All the columns, in index order. */
  public static final ImmutableList<Column> ALL;

  /** The index, 0..8. */
  public final int index;

  public static Column ofIndex(int index) {
    return ALL.get(index);
  }

  @Override public Type getType() {
    return Type.COLUMN;
  }

  @Override public String toString() {
    return "Column " + (index + 1);
  }

  private Column(int index) {
    this.index = index;
    for (int i = 0; i < 9; ++i)
      locations[i] = (byte) (i * 9 + index);
  }

  static {
    ImmutableList.Builder<Column> builder = ImmutableList.builder();
    for (int i = 0; i < 9; ++i)
      builder.add(new Column(i));
    ALL = builder.build();
  }
}
