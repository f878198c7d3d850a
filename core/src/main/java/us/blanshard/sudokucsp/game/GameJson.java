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

import us.blanshard.sudokucsp.core.Grid;
import us.blanshard.sudokucsp.gen.Puzzle;
import us.blanshard.sudokucsp.insight.Hint;

import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.Lists;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.List;

/**
 * Converts grids, puzzles, grid states and hints to and from json.  Grids
 * are nested arrays of rows, each an array of nine numbers with 0 for an
 * empty cell.
 */
public class GameJson {

  /** The names by which grid states are written. */
  public static final ImmutableBiMap<Grid.State, String> STATE_NAMES = ImmutableBiMap.of(
      Grid.State.WIN, "Win",
      Grid.State.INCOMPLETE, "Incomplete",
      Grid.State.INVALID, "Invalid");

  public static final TypeAdapter<Grid> GRID_ADAPTER = new TypeAdapter<Grid>() {
    @Override public void write(JsonWriter out, Grid value) throws IOException {
      out.beginArray();
      for (int[] row : value.toRows()) {
        out.beginArray();
        for (int n : row)
          out.value(n);
        out.endArray();
      }
      out.endArray();
    }

    @Override public Grid read(JsonReader in) throws IOException {
      List<int[]> rows = Lists.newArrayList();
      try {
        in.beginArray();
        while (in.hasNext()) {
          List<Integer> row = Lists.newArrayList();
          in.beginArray();
          while (in.hasNext())
            row.add(in.nextInt());
          in.endArray();
          int[] array = new int[row.size()];
          for (int i = 0; i < array.length; ++i)
            array[i] = row.get(i);
          rows.add(array);
        }
        in.endArray();
        return Grid.fromRows(rows.toArray(new int[rows.size()][]));
      } catch (IllegalStateException | IllegalArgumentException e) {
        throw new JsonParseException("Malformed grid", e);
      }
    }
  }.nullSafe();

  public static final TypeAdapter<Grid.State> STATE_ADAPTER = new TypeAdapter<Grid.State>() {
    @Override public void write(JsonWriter out, Grid.State value) throws IOException {
      out.value(STATE_NAMES.get(value));
    }

    @Override public Grid.State read(JsonReader in) throws IOException {
      String name = in.nextString();
      Grid.State state = STATE_NAMES.inverse().get(name);
      if (state == null)
        throw new JsonParseException("Unknown grid state: " + name);
      return state;
    }
  }.nullSafe();

  public static final TypeAdapter<Puzzle> PUZZLE_ADAPTER = new TypeAdapter<Puzzle>() {
    @Override public void write(JsonWriter out, Puzzle value) throws IOException {
      out.beginObject();
      out.name("puzzle");
      GRID_ADAPTER.write(out, value.getPuzzle());
      out.name("solution");
      GRID_ADAPTER.write(out, value.getSolution());
      out.endObject();
    }

    @Override public Puzzle read(JsonReader in) throws IOException {
      Grid puzzle = null;
      Grid solution = null;
      in.beginObject();
      while (in.hasNext()) {
        String name = in.nextName();
        if (name.equals("puzzle")) {
          puzzle = GRID_ADAPTER.read(in);
        } else if (name.equals("solution")) {
          solution = GRID_ADAPTER.read(in);
        } else {
          in.skipValue();
        }
      }
      in.endObject();
      if (puzzle == null || solution == null)
        throw new JsonParseException("A puzzle needs both \"puzzle\" and \"solution\"");
      try {
        return new Puzzle(puzzle, solution);
      } catch (IllegalArgumentException e) {
        throw new JsonParseException("Inconsistent puzzle", e);
      }
    }
  }.nullSafe();

  /** Writes hints with their reasoning; hints are never read back. */
  public static final TypeAdapter<Hint> HINT_ADAPTER = new TypeAdapter<Hint>() {
    @Override public void write(JsonWriter out, Hint value) throws IOException {
      out.beginObject();
      out.name("row").value(value.getLocation().row.index);
      out.name("col").value(value.getLocation().column.index);
      out.name("value").value(value.getValue());
      out.name("kind").value(value.getKind().name());
      out.name("reasoning").value(value.describe());
      out.endObject();
    }

    @Override public Hint read(JsonReader in) throws IOException {
      throw new UnsupportedOperationException("Hints are write-only");
    }
  }.nullSafe();

  /** A convenience for reading and writing everything this class knows. */
  public static final Gson GSON = register(new GsonBuilder()).create();

  /**
   * Registers type adapters in the given builder so that grids, puzzles,
   * grid states and hints can be serialized.
   */
  public static GsonBuilder register(GsonBuilder builder) {
    builder.registerTypeAdapter(Grid.class, GRID_ADAPTER);
    builder.registerTypeAdapter(Grid.State.class, STATE_ADAPTER);
    builder.registerTypeAdapter(Puzzle.class, PUZZLE_ADAPTER);
    builder.registerTypeAdapter(Hint.class, HINT_ADAPTER);
    return builder;
  }

  public static String toJson(Grid grid) {
    return GSON.toJson(grid, Grid.class);
  }

  /**
   * Reads a grid from json.
   *
   * @throws JsonParseException if the json is not nine rows of nine values
   */
  public static Grid toGrid(String json) {
    return GSON.fromJson(json, Grid.class);
  }

  public static String toJson(Puzzle puzzle) {
    return GSON.toJson(puzzle, Puzzle.class);
  }

  public static Puzzle toPuzzle(String json) {
    return GSON.fromJson(json, Puzzle.class);
  }
}
