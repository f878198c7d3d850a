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

import us.blanshard.sudokucsp.core.Location;
import us.blanshard.sudokucsp.gen.Difficulty;
import us.blanshard.sudokucsp.insight.Hint;

import com.google.common.base.MoreObjects;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;

/**
 * Something that happened in a {@link Game}, as reported to its listeners.
 * Events are immutable snapshots; they hold no reference to the game's grid.
 */
@Immutable
public abstract class GameEvent {

  /** The kinds of events. */
  public enum Type {
    PUZZLE_GENERATED,
    HINT_USED,
    MISTAKE_MADE,
    SOLVED
  }

  public final Type type;

  /** Milliseconds of play, not counting suspensions, when the event happened. */
  public final long elapsedMillis;

  private GameEvent(Type type, long elapsedMillis) {
    this.type = type;
    this.elapsedMillis = elapsedMillis;
  }

  MoreObjects.ToStringHelper toStringHelper() {
    return MoreObjects.toStringHelper(this).add("elapsedMillis", elapsedMillis);
  }

  @Override public String toString() {
    return toStringHelper().toString();
  }

  /** A new game has started on a freshly generated or supplied puzzle. */
  public static final class PuzzleGenerated extends GameEvent {
    /** The tier the puzzle was generated for, or null if it was supplied. */
    @Nullable public final Difficulty difficulty;
    public final int cellsCleared;

    public PuzzleGenerated(@Nullable Difficulty difficulty, int cellsCleared) {
      super(Type.PUZZLE_GENERATED, 0);
      this.difficulty = difficulty;
      this.cellsCleared = cellsCleared;
    }

    @Override MoreObjects.ToStringHelper toStringHelper() {
      return super.toStringHelper().add("difficulty", difficulty).add("cellsCleared", cellsCleared);
    }
  }

  /** The player asked for a hint. */
  public static final class HintUsed extends GameEvent {
    public final Location location;
    public final Hint.Kind kind;
    public final int value;

    public HintUsed(long elapsedMillis, Location location, Hint.Kind kind, int value) {
      super(Type.HINT_USED, elapsedMillis);
      this.location = checkNotNull(location);
      this.kind = checkNotNull(kind);
      this.value = value;
    }

    @Override MoreObjects.ToStringHelper toStringHelper() {
      return super.toStringHelper().add("location", location).add("kind", kind).add("value", value);
    }
  }

  /** The player entered a value that differs from the solution. */
  public static final class MistakeMade extends GameEvent {
    public final Location location;
    public final int value;

    public MistakeMade(long elapsedMillis, Location location, int value) {
      super(Type.MISTAKE_MADE, elapsedMillis);
      this.location = checkNotNull(location);
      this.value = value;
    }

    @Override MoreObjects.ToStringHelper toStringHelper() {
      return super.toStringHelper().add("location", location).add("value", value);
    }
  }

  /** The grid reached a win, either by the player's moves or by asking for the solution. */
  public static final class Solved extends GameEvent {
    public final boolean byPlayer;
    public final int hintsUsed;
    public final int mistakes;

    public Solved(long elapsedMillis, boolean byPlayer, int hintsUsed, int mistakes) {
      super(Type.SOLVED, elapsedMillis);
      this.byPlayer = byPlayer;
      this.hintsUsed = hintsUsed;
      this.mistakes = mistakes;
    }

    @Override MoreObjects.ToStringHelper toStringHelper() {
      return super.toStringHelper().add("byPlayer", byPlayer)
          .add("hintsUsed", hintsUsed).add("mistakes", mistakes);
    }
  }
}
