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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import us.blanshard.sudokucsp.core.CellOccupiedException;
import us.blanshard.sudokucsp.core.Grid;
import us.blanshard.sudokucsp.core.Location;
import us.blanshard.sudokucsp.core.Numeral;
import us.blanshard.sudokucsp.engine.SudokuEngine;
import us.blanshard.sudokucsp.gen.Difficulty;
import us.blanshard.sudokucsp.gen.Puzzle;
import us.blanshard.sudokucsp.insight.Hint;
import us.blanshard.sudokucsp.insight.Hinter;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;

import java.util.LinkedList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * One player's session on one puzzle.  The engine itself keeps no game
 * state; this class does, and reports what happens to its listeners as
 * {@link GameEvent}s.
 */
@NotThreadSafe
public final class Game {
  private static final Logger logger = Logger.getLogger(Game.class.getName());

  private final Puzzle puzzle;
  @Nullable private final Difficulty difficulty;
  private final Registry registry;
  private final Stopwatch stopwatch;

  /** The clues, which the player may not change. */
  private final Grid clues;

  /** The current state of play. */
  private Grid grid;
  private int hintsUsed;
  private int mistakes;
  private boolean solved;

  /** Generates a puzzle with the given engine and starts a game on it. */
  public static Game start(SudokuEngine engine, Difficulty difficulty, Registry registry) {
    return new Game(engine.generate(difficulty), difficulty, registry);
  }

  public Game(Puzzle puzzle, @Nullable Difficulty difficulty, Registry registry) {
    this(puzzle, difficulty, registry, Ticker.systemTicker());
  }

  Game(Puzzle puzzle, @Nullable Difficulty difficulty, Registry registry, Ticker ticker) {
    this.puzzle = checkNotNull(puzzle);
    this.difficulty = difficulty;
    this.registry = checkNotNull(registry);
    this.stopwatch = Stopwatch.createUnstarted(ticker);
    this.clues = puzzle.getPuzzle();
    this.grid = clues.copy();
    stopwatch.start();
    logger.info("Game started: " + (difficulty == null ? "supplied puzzle" : difficulty)
        + ", " + puzzle.getCellsCleared() + " cells cleared");
    registry.asListener().puzzleGenerated(
        this, new GameEvent.PuzzleGenerated(difficulty, puzzle.getCellsCleared()));
  }

  public Puzzle getPuzzle() {
    return puzzle;
  }

  @Nullable public Difficulty getDifficulty() {
    return difficulty;
  }

  public Registry getListenerRegistry() {
    return registry;
  }

  /** Returns a copy of the current grid. */
  public Grid getGrid() {
    return grid.copy();
  }

  public int get(int row, int col) {
    return grid.get(row, col);
  }

  public int getHintsUsed() {
    return hintsUsed;
  }

  public int getMistakes() {
    return mistakes;
  }

  /** Tells whether the grid has reached a win. */
  public boolean isSolved() {
    return solved;
  }

  /** Returns the elapsed play time in milliseconds, not counting suspensions. */
  public long elapsedMillis() {
    return stopwatch.elapsed(TimeUnit.MILLISECONDS);
  }

  /** Tells whether the game is in its normal running state. */
  public boolean isRunning() {
    return stopwatch.isRunning();
  }

  /** Suspends the game.  No moves are possible while the game is suspended. */
  public Game suspend() {
    if (stopwatch.isRunning()) stopwatch.stop();
    return this;
  }

  /** Resumes the game from a suspended state. */
  public Game resume() {
    if (!stopwatch.isRunning() && !solved) stopwatch.start();
    return this;
  }

  /** Tells whether the player may change the given cell. */
  public boolean canModify(int row, int col) {
    return clues.get(row, col) == 0;
  }

  /**
   * Sets or clears (value 0) the given cell, tells whether it worked.  It
   * doesn't work while the game is suspended or after it is solved.  A value
   * that differs from the solution's is kept but counted as a mistake.
   *
   * @throws CellOccupiedException if the cell holds one of the puzzle's clues
   * @throws us.blanshard.sudokucsp.core.InvalidValueException if the value
   *     is outside 0..9
   */
  public boolean set(int row, int col, int value) {
    Location loc = Location.of(row, col);
    Numeral num = Numeral.numeral(value);
    if (!canModify(row, col))
      throw new CellOccupiedException(loc, clues.get(loc));
    if (!isRunning() || solved) return false;

    if (num == null) {
      grid.clear(loc);
      return true;
    }
    grid.set(loc, num);
    if (value != puzzle.getSolutionValue(row, col)) {
      ++mistakes;
      registry.asListener().mistakeMade(
          this, new GameEvent.MistakeMade(elapsedMillis(), loc, value));
    }
    if (grid.getState() == Grid.State.WIN)
      finish(true);
    return true;
  }

  /**
   * Gives a hint for the given empty cell and counts it against the player.
   *
   * @throws IllegalStateException if the game is suspended or solved
   * @throws CellOccupiedException if the cell is filled
   */
  public Hint hint(int row, int col) {
    checkState(isRunning() && !solved, "No hints while the game is suspended or solved");
    Hint hint = Hinter.hint(grid, row, col);
    ++hintsUsed;
    registry.asListener().hintUsed(this, new GameEvent.HintUsed(
        elapsedMillis(), hint.getLocation(), hint.getKind(), hint.getValue()));
    return hint;
  }

  /** Gives up and fills in the solution. */
  public Game solve() {
    if (!solved) {
      grid = puzzle.getSolution();
      finish(false);
    }
    return this;
  }

  /**
   * Restores the puzzle's clues and starts the clock and counts over.  The
   * replay is a new game as far as listeners are concerned.
   */
  public Game reset() {
    grid = clues.copy();
    hintsUsed = 0;
    mistakes = 0;
    solved = false;
    stopwatch.reset().start();
    logger.info("Game reset: " + puzzle.getCellsCleared() + " cells cleared");
    registry.asListener().puzzleGenerated(
        this, new GameEvent.PuzzleGenerated(difficulty, puzzle.getCellsCleared()));
    return this;
  }

  private void finish(boolean byPlayer) {
    solved = true;
    stopwatch.stop();
    long millis = elapsedMillis();
    logger.info("Game solved " + (byPlayer ? "by the player" : "by the engine") + " in "
        + millis + " ms with " + hintsUsed + " hints and " + mistakes + " mistakes");
    registry.asListener().solved(
        this, new GameEvent.Solved(millis, byPlayer, hintsUsed, mistakes));
  }

  /** Returns a listener registry that refuses to take listeners. */
  public static Registry nullRegistry() {
    return NULL_REGISTRY;
  }

  /** Creates a registry that does the normal thing. */
  public static Registry newRegistry() {
    return new NormalRegistry();
  }

  /**
   * A callback interface for interested parties to find out what's going on
   * in a game.
   */
  public interface Listener {
    /** Called when a game starts on a new puzzle. */
    void puzzleGenerated(Game game, GameEvent.PuzzleGenerated event);

    /** Called when the player has been given a hint. */
    void hintUsed(Game game, GameEvent.HintUsed event);

    /** Called when the player enters a wrong value. */
    void mistakeMade(Game game, GameEvent.MistakeMade event);

    /** Called when the grid reaches a win. */
    void solved(Game game, GameEvent.Solved event);
  }

  /**
   * A null implementation of {@link Listener} so you can have a listener
   * without having to implement every method.
   */
  public static class Adapter implements Listener {
    @Override public void puzzleGenerated(Game game, GameEvent.PuzzleGenerated event) {}
    @Override public void hintUsed(Game game, GameEvent.HintUsed event) {}
    @Override public void mistakeMade(Game game, GameEvent.MistakeMade event) {}
    @Override public void solved(Game game, GameEvent.Solved event) {}
  }

  /**
   * An object that keeps track of the {@linkplain Listener listeners} on
   * behalf of one or more games.
   */
  public abstract static class Registry {

    /** Adds a listener to the registry. */
    public abstract void addListener(Listener listener);

    /** Removes a listener from the registry. */
    public abstract void removeListener(Listener listener);

    /**
     * Exposes the registry as a listener itself, so the game has a single
     * instance to address.
     */
    protected abstract Listener asListener();
  }

  private static final Listener NULL_LISTENER = new Adapter();
  private static final Registry NULL_REGISTRY = new NullRegistry();

  private static class NullRegistry extends Registry {
    @Override public void addListener(Listener listener) {
      throw new UnsupportedOperationException();
    }
    @Override public void removeListener(Listener listener) {
      throw new UnsupportedOperationException();
    }
    @Override protected Listener asListener() { return NULL_LISTENER; }
  }

  private static class NormalRegistry extends Registry implements Listener {
    private final List<Listener> listeners = new LinkedList<Listener>();

    @Override public void addListener(Listener listener) {
      listeners.add(listener);
    }

    @Override public void removeListener(Listener listener) {
      listeners.remove(listener);
    }

    @Override protected Listener asListener() {
      return this;
    }

    @Override public void puzzleGenerated(Game game, GameEvent.PuzzleGenerated event) {
      for (Listener listener : listeners)
        listener.puzzleGenerated(game, event);
    }

    @Override public void hintUsed(Game game, GameEvent.HintUsed event) {
      for (Listener listener : listeners)
        listener.hintUsed(game, event);
    }

    @Override public void mistakeMade(Game game, GameEvent.MistakeMade event) {
      for (Listener listener : listeners)
        listener.mistakeMade(game, event);
    }

    @Override public void solved(Game game, GameEvent.Solved event) {
      for (Listener listener : listeners)
        listener.solved(game, event);
    }
  }
}
