/**
 * Copyright 2015 Brigham Young University
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package edu.byu.nlp.hmm.inference;

import com.google.common.base.Preconditions;

/**
 * Shape checks for the caller-provided dynamic programming buffers. Lattices are indexed
 * {@code [state][time]}.
 */
public class Lattices {

  private Lattices() {}

  public static void checkShape(double[][] lattice, int numStates, int length, String name) {
    Preconditions.checkNotNull(lattice, "%s is null", name);
    Preconditions.checkArgument(lattice.length == numStates,
        "%s must have %s rows (one per state) but has %s", name, numStates, lattice.length);
    for (int s = 0; s < lattice.length; s++) {
      Preconditions.checkArgument(lattice[s] != null && lattice[s].length == length,
          "row %s of %s must have length %s", s, name, length);
    }
  }

  public static void checkShape(int[][] lattice, int numStates, int length, String name) {
    Preconditions.checkNotNull(lattice, "%s is null", name);
    Preconditions.checkArgument(lattice.length == numStates,
        "%s must have %s rows (one per state) but has %s", name, numStates, lattice.length);
    for (int s = 0; s < lattice.length; s++) {
      Preconditions.checkArgument(lattice[s] != null && lattice[s].length == length,
          "row %s of %s must have length %s", s, name, length);
    }
  }

}
