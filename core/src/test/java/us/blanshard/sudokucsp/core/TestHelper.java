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
 * Short factories for tests.  Rows and columns are 0-based, as everywhere
 * in the engine's API.
 */
public class TestHelper {
  /** A solved grid. */
  public static final String SOLUTION =
      " 5 3 4 | 6 7 8 | 9 1 2 " +
      " 6 7 2 | 1 9 5 | 3 4 8 " +
      " 1 9 8 | 3 4 2 | 5 6 7 " +
      "-------+-------+-------" +
      " 8 5 9 | 7 6 1 | 4 2 3 " +
      " 4 2 6 | 8 5 3 | 7 9 1 " +
      " 7 1 3 | 9 2 4 | 8 5 6 " +
      "-------+-------+-------" +
      " 9 6 1 | 5 3 7 | 2 8 4 " +
      " 2 8 7 | 4 1 9 | 6 3 5 " +
      " 3 4 5 | 2 8 6 | 1 7 9 ";

  /** A puzzle whose only solution is {@link #SOLUTION}. */
  public static final String PUZZLE =
      " 5 3 . | . 7 . | . . . " +
      " 6 . . | 1 9 5 | . . . " +
      " . 9 8 | . . . | . 6 . " +
      "-------+-------+-------" +
      " 8 . . | . 6 . | . . 3 " +
      " 4 . . | 8 . 3 | . . 1 " +
      " 7 . . | . 2 . | . . 6 " +
      "-------+-------+-------" +
      " . 6 . | . . . | 2 8 . " +
      " . . . | 4 1 9 | . . 5 " +
      " . . . | . 8 . | . 7 9 ";

  public static Grid g(String s) { return Grid.fromString(s); }
  public static Numeral n(int num) { return Numeral.of(num); }
  public static NumSet ns(int... nums) { return NumSet.ofNumbers(nums); }
  public static Location l(int row, int col) { return Location.of(row, col); }
  public static Assignment a(int row, int col, int num) { return Assignment.of(row, col, num); }
}
