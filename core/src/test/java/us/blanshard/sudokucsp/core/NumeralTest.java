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
import static org.junit.Assert.fail;

import org.junit.Test;

public class NumeralTest {

  @Test public void all() {
    assertEquals(9, Numeral.ALL.size());
    int count = 0;
    for (Numeral num : Numeral.ALL) {
      assertEquals(count, num.index);
      assertEquals(count + 1, num.number);
      assertSame(num, Numeral.of(num.number));
      assertSame(num, Numeral.ofIndex(num.index));
      ++count;
    }
  }

  @Test public void numeral() {
    assertThat(Numeral.numeral(0)).isNull();
    assertThat(Numeral.numeral(9)).isSameInstanceAs(Numeral.of(9));
    assertThat(Numeral.number(null)).isEqualTo(0);
    assertThat(Numeral.number(Numeral.of(4))).isEqualTo(4);
  }

  @Test public void outOfRange() {
    try {
      Numeral.of(0);
      fail();
    } catch (InvalidValueException e) {
      assertThat(e.getValue()).isEqualTo(0);
    }
    try {
      Numeral.numeral(10);
      fail();
    } catch (InvalidValueException e) {
      assertThat(e.getValue()).isEqualTo(10);
    }
  }
}
