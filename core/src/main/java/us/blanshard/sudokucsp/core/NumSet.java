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

import java.util.AbstractSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * An immutable set of Numerals, held as a 9-bit mask.  This is the type of a
 * cell's candidate set and of the values present in a unit.  Iteration is in
 * increasing numeric order.
 */
@Immutable
public final class NumSet extends AbstractSet<Numeral> implements Set<Numeral> {

  /** The mask with all nine bits on. */
  public static final int ALL_BITS = (1 << Numeral.COUNT) - 1;

  /** The numerals in this set expressed as a bit set. */
  public final short bits;

  private final byte[] nums;

  private NumSet(short bits) {
    this.bits = bits;

    this.nums = new byte[Integer.bitCount(bits)];
    byte num = 1;
    int count = 0;
    for (int bit = 1; bit <= bits; bit = bit << 1, ++num) {
      if ((bits & bit) != 0) {
        nums[count++] = num;
      }
    }
  }

  /** Returns the set corresponding to the given bit set. */
  public static NumSet ofBits(int bits) {
    return instances[bits & ALL_BITS];
  }

  /** Returns the set containing the given numerals. */
  public static NumSet of(Numeral... nums) {
    int bits = 0;
    for (Numeral n : nums)
      bits |= n.bit;
    return instances[bits];
  }

  /** Returns the set containing the given numbers, each in 1..9. */
  public static NumSet ofNumbers(int... numbers) {
    int bits = 0;
    for (int n : numbers)
      bits |= Numeral.of(n).bit;
    return instances[bits];
  }

  /** The empty set. */
  public static final NumSet NONE;

  /** The set of all nine numerals. */
  public static final NumSet ALL;

  /** Returns the complement of this set. */
  public NumSet not() {
    return instances[ALL_BITS & (~this.bits)];
  }

  /** Returns the intersection of this set and another one. */
  public NumSet and(NumSet that) {
    return instances[this.bits & that.bits];
  }

  /** Returns the union of this set and another one. */
  public NumSet or(NumSet that) {
    return instances[this.bits | that.bits];
  }

  /** Returns the asymmetric difference of this set and another one. */
  public NumSet minus(NumSet that) {
    return instances[this.bits & (~that.bits)];
  }

  /** Returns this set plus the given numeral. */
  public NumSet with(Numeral num) {
    return instances[this.bits | num.bit];
  }

  public boolean contains(Numeral num) {
    return (bits & num.bit) != 0;
  }

  /** Tells whether the given number, which need not be in 1..9, is in this set. */
  public boolean containsNumber(int number) {
    return number >= 1 && number <= Numeral.COUNT && (bits & (1 << (number - 1))) != 0;
  }

  @Override public boolean contains(Object o) {
    if (o instanceof Numeral) {
      return contains((Numeral) o);
    }
    return false;
  }

  /** Returns the numeral at the given index within this set. */
  public Numeral get(int index) {
    return Numeral.of(nums[index]);
  }

  /**
   * Returns the smallest numeral in this set.
   *
   * @throws NoSuchElementException if the set is empty
   */
  public Numeral first() {
    if (nums.length == 0) throw new NoSuchElementException();
    return Numeral.of(nums[0]);
  }

  @Override public Iterator<Numeral> iterator() {
    return new Iter();
  }

  @Override public int size() {
    return nums.length;
  }

  @Override public boolean isEmpty() {
    return bits == 0;
  }

  @Override public boolean equals(Object o) {
    if (this == o) return true;
    if (o instanceof NumSet) return bits == ((NumSet) o).bits;
    return super.equals(o);
  }

  @Override public int hashCode() {
    // Must match Set's contract.
    int answer = 0;
    for (byte num : nums) answer += num;
    return answer;
  }

  private class Iter implements Iterator<Numeral> {
    private int nextIndex;

    @Override public boolean hasNext() {
      return nextIndex < nums.length;
    }

    @Override public Numeral next() {
      if (!hasNext()) throw new NoSuchElementException();
      return Numeral.of(nums[nextIndex++]);
    }

    @Override public void remove() {
      throw new UnsupportedOperationException();
    }
  }

  private static final NumSet[] instances;
  static {
    instances = new NumSet[1 << Numeral.COUNT];
    for (short i = 0; i < instances.length; ++i) {
      instances[i] = new NumSet(i);
    }
    NONE = instances[0];
    ALL = instances[ALL_BITS];
  }
}
