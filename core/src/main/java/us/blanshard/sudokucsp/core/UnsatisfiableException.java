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

/**
 * Reports that a puzzle has no solution: the solver searched every branch
 * without completing the grid.  Solving is deterministic, so retrying the same
 * puzzle gives the same answer.
 */
public class UnsatisfiableException extends Exception {
  private static final long serialVersionUID = 1L;

  private final int numSteps;

  public UnsatisfiableException(Grid puzzle, int numSteps) {
    super("No solution after " + numSteps + " steps for " + puzzle.toFlatString());
    this.numSteps = numSteps;
  }

  /** The number of guesses the solver made before giving up. */
  public int getNumSteps() {
    return numSteps;
  }
}
