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

/**
 * Difficulty tiers for generated puzzles, each tied to the number of cells
 * cleared from the solution.  Harder tiers clear more cells.
 */
public enum Difficulty {
  BEGINNER(15),
  EASY(30),
  INTERMEDIATE(45),
  HARD(55),
  EXTREME(65);

  private final int cellsToClear;

  private Difficulty(int cellsToClear) {
    this.cellsToClear = cellsToClear;
  }

  /** The number of cells the generator tries to clear for this tier. */
  public int getCellsToClear() {
    return cellsToClear;
  }

  /**
   * Returns the hardest tier that clears no more than the given number of
   * cells, or the easiest tier for counts below all of them.
   */
  public static Difficulty forCellsToClear(int cellsToClear) {
    checkArgument(cellsToClear >= 0 && cellsToClear <= 81,
        "cells to clear must be in 0..81: %s", cellsToClear);
    Difficulty answer = BEGINNER;
    for (Difficulty d : values()) {
      if (d.cellsToClear <= cellsToClear) answer = d;
    }
    return answer;
  }
}
