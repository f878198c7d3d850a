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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * A value from one to nine: the contents of a filled Sudoku cell.  There is
 * exactly one instance per value, so identity comparison is safe.
 */
@Immutable
public final class Numeral implements Comparable<Numeral> {
  /** The number of Numerals. */
  public static final int COUNT = 9;

  /** The number, in the range 1..9. */
  public final int number;

  /** The index, one less than the number. */
  public final int index;

  /** The bit corresponding to the number, 1 &lt;&lt; index. */
  public final short bit;

  /**
   * Returns the numeral for the given number.
   *
   * @throws InvalidValueException if the number is not in 1..9
   */
  public static Numeral of(int number) {
    if (number < 1 || number > COUNT)
      throw new InvalidValueException(number, 1);
    return instances[number - 1];
  }

  public static Numeral ofIndex(int index) {
    return instances[index];
  }

  /**
   * Converts 0 to null, 1-9 to the corresponding numeral.
   *
   * @throws InvalidValueException if the number is not in 0..9
   */
  @Nullable public static Numeral numeral(int number) {
    if (number == 0) return null;
    if (number < 0 || number > COUNT)
      throw new InvalidValueException(number, 0);
    return instances[number - 1];
  }

  /** Converts null to 0, non-null to the corresponding number. */
  public static int number(@Nullable Numeral num) {
    return num == null ? 0 : num.number;
  }

  public NumSet asSet() {
    return NumSet.ofBits(bit);
  }

  /** All the numerals, in increasing order. */
  public static final List<Numeral> ALL;

  @Override public int compareTo(Numeral that) {
    return this.index - that.index;
  }

  @Override public String toString() {
    return Integer.toString(number);
  }

  @Override public boolean equals(Object o) {
    return this == o;
  }

  @Override public int hashCode() {
    return number;  // Relied upon by NumSet
  }

  private Numeral(int index) {
    this.index = index;
    this.number = index + 1;
    this.bit = (short) (1 << index);
  }

  private static final Numeral[] instances;
  static {
    instances = new Numeral[COUNT];
    for (int i = 0; i < COUNT; ++i) {
      instances[i] = new Numeral(i);
    }
    ALL = Collections.unmodifiableList(Arrays.asList(instances));
  }
}
