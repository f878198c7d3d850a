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

import us.blanshard.sudokucsp.core.Assignment;
import us.blanshard.sudokucsp.core.Grid;

/**
 * A fact about a Sudoku grid that forces a value into a cell without any
 * guessing.
 */
public abstract class Insight {

  /**
   * All the types of insight we recognize.
   */
  public enum Type {
    /** A cell with only one candidate: a naked single. */
    FORCED_NUMERAL,
    /** A value with only one possible cell in some unit: a hidden single. */
    FORCED_LOCATION;
  }

  public final Type type;

  protected Insight(Type type) {
    this.type = type;
  }

  /** The assignment this insight implies. */
  public abstract Assignment getAssignment();

  /** Places this insight's assignment in the given grid. */
  public void apply(Grid grid) {
    Assignment assignment = getAssignment();
    grid.set(assignment.location, assignment.numeral);
  }

  /** Tells whether this insight still holds for the given grid. */
  public abstract boolean isImpliedBy(Grid grid);

  /** Returns a sentence describing this insight for display. */
  public abstract String describe();
}
