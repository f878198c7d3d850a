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
package us.blanshard.sudokucsp.stats;

import us.blanshard.sudokucsp.game.Game;
import us.blanshard.sudokucsp.game.GameEvent;
import us.blanshard.sudokucsp.gen.Difficulty;

import com.google.common.base.Strings;
import com.google.common.collect.EnumMultiset;
import com.google.common.collect.Multiset;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.Formatter;
import java.util.Locale;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Tracks how a player fares over many games.  Register an instance with the
 * games' {@link Game.Registry} before the games start; it learns everything
 * from the events they emit.
 */
@NotThreadSafe
public class GameStatistics extends Game.Adapter {

  private int gamesPlayed;
  private int gamesWon;
  private int gamesGivenUp;
  private int hintsUsed;
  private int mistakes;
  private final Multiset<Difficulty> playedByDifficulty = EnumMultiset.create(Difficulty.class);

  /** Seconds spent on every finished game, won or given up. */
  private final SummaryStatistics playTimes = new SummaryStatistics();

  /** Seconds spent on games the player won. */
  private final SummaryStatistics solveTimes = new SummaryStatistics();

  @Override public void puzzleGenerated(Game game, GameEvent.PuzzleGenerated event) {
    ++gamesPlayed;
    if (event.difficulty != null)
      playedByDifficulty.add(event.difficulty);
  }

  @Override public void hintUsed(Game game, GameEvent.HintUsed event) {
    ++hintsUsed;
  }

  @Override public void mistakeMade(Game game, GameEvent.MistakeMade event) {
    ++mistakes;
  }

  @Override public void solved(Game game, GameEvent.Solved event) {
    double seconds = event.elapsedMillis / 1000.0;
    playTimes.addValue(seconds);
    if (event.byPlayer) {
      ++gamesWon;
      solveTimes.addValue(seconds);
    } else {
      ++gamesGivenUp;
    }
  }

  public int getGamesPlayed() {
    return gamesPlayed;
  }

  public int getGamesWon() {
    return gamesWon;
  }

  /** The number of games finished by asking for the solution. */
  public int getGamesGivenUp() {
    return gamesGivenUp;
  }

  public int getHintsUsed() {
    return hintsUsed;
  }

  public int getMistakes() {
    return mistakes;
  }

  /** The number of games started at the given difficulty. */
  public int getGamesPlayed(Difficulty difficulty) {
    return playedByDifficulty.count(difficulty);
  }

  /** Percentage of games played that the player won, 0 if none played. */
  public double getWinRate() {
    return gamesPlayed == 0 ? 0 : 100.0 * gamesWon / gamesPlayed;
  }

  /** Total seconds spent on finished games. */
  public double getTotalSeconds() {
    return playTimes.getSum();
  }

  /** Mean seconds per finished game, 0 if none finished. */
  public double getMeanSeconds() {
    return playTimes.getN() == 0 ? 0 : playTimes.getMean();
  }

  /** Mean seconds per won game, 0 if none won. */
  public double getMeanSolveSeconds() {
    return solveTimes.getN() == 0 ? 0 : solveTimes.getMean();
  }

  /** Fastest win in seconds, 0 if none won. */
  public double getBestSolveSeconds() {
    return solveTimes.getN() == 0 ? 0 : solveTimes.getMin();
  }

  /** Returns a printable report of the statistics. */
  public String getSummary() {
    String rule = Strings.repeat("=", 40);
    Formatter out = new Formatter(Locale.US);
    out.format("%s%n", rule);
    out.format("GAME STATISTICS%n");
    out.format("%s%n", rule);
    out.format("Games Played: %d%n", gamesPlayed);
    for (Multiset.Entry<Difficulty> entry : playedByDifficulty.entrySet())
      out.format("  %s: %d%n", entry.getElement(), entry.getCount());
    out.format("Games Won: %d%n", gamesWon);
    out.format("Games Given Up: %d%n", gamesGivenUp);
    out.format("Win Rate: %.1f%%%n", getWinRate());
    out.format("Total Time: %.1f seconds%n", getTotalSeconds());
    out.format("Average Time per Game: %.1f seconds%n", getMeanSeconds());
    out.format("Best Solve Time: %.1f seconds%n", getBestSolveSeconds());
    out.format("Total Hints Used: %d%n", hintsUsed);
    out.format("Total Mistakes: %d%n", mistakes);
    out.format("%s%n", rule);
    return out.toString();
  }

  @Override public String toString() {
    return getSummary();
  }
}
