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
package us.blanshard.sudokucsp.game;

import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static us.blanshard.sudokucsp.core.TestHelper.PUZZLE;
import static us.blanshard.sudokucsp.core.TestHelper.SOLUTION;
import static us.blanshard.sudokucsp.core.TestHelper.g;

import us.blanshard.sudokucsp.gen.Puzzle;

import com.google.common.base.Ticker;

public class Fixtures {

  static final Puzzle puzzle = new Puzzle(g(PUZZLE), g(SOLUTION));

  // A ticker that only moves when told to.
  static class ManualTicker extends Ticker {
    private long nanos;

    @Override public long read() {
      return nanos;
    }

    void advanceMillis(long millis) {
      nanos += MILLISECONDS.toNanos(millis);
    }
  }

  static Game makeGame(Game.Registry registry, Ticker ticker) {
    return new Game(puzzle, null, registry, ticker);
  }

  static Game makeGame(Game.Registry registry) {
    return makeGame(registry, new ManualTicker());
  }

  static Game makeGame() {
    return makeGame(Game.nullRegistry());
  }

  /** Fills in every open cell with the solution's value. */
  static void playToWin(Game game) {
    for (int row = 0; row < 9; ++row)
      for (int col = 0; col < 9; ++col)
        if (game.canModify(row, col))
          game.set(row, col, puzzle.getSolutionValue(row, col));
  }
}
