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
 * Thrown when a cell value falls outside the range the operation accepts:
 * 0..9 for storing into a grid, 1..9 for a placement.
 */
public class InvalidValueException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final int value;

  public InvalidValueException(int value, int lowest) {
    super(String.format("Value %d is outside %d..9", value, lowest));
    this.value = value;
  }

  /** The rejected value. */
  public int getValue() {
    return value;
  }
}
