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
package edu.byu.nlp.hmm.io;

import java.io.File;
import java.io.IOException;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.io.Files;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonSyntaxException;

import edu.byu.nlp.hmm.HmmParameters;

/**
 * The minimal state needed to save and restore an HMM: pi, A and B.
 * <p>
 * Restoring goes through {@link HmmParameters#of}, so a file with inconsistent shapes or
 * rows that are not distributions is rejected.
 */
public class SerializableHmmParameters {

  private double[] initialProbs;
  private double[][] transitions;
  private double[][] emissions;

  public static SerializableHmmParameters of(HmmParameters params) {
    Preconditions.checkNotNull(params);
    SerializableHmmParameters state = new SerializableHmmParameters();
    state.initialProbs = params.getInitialProbs();
    state.transitions = params.getTransitions();
    state.emissions = params.getEmissions();
    return state;
  }

  public HmmParameters toParameters() {
    Preconditions.checkState(initialProbs != null && transitions != null && emissions != null,
        "serialized model is missing one of initialProbs, transitions or emissions");
    return HmmParameters.of(initialProbs, transitions, emissions);
  }

  public String toJson() {
    return gson().toJson(this);
  }

  public static SerializableHmmParameters fromJson(String json) throws JsonSyntaxException {
    SerializableHmmParameters state = gson().fromJson(json, SerializableHmmParameters.class);
    Preconditions.checkArgument(state != null, "empty json document");
    return state;
  }

  public void serializeTo(String filename) throws IOException {
    Files.asCharSink(new File(filename), Charsets.UTF_8).write(toJson());
  }

  public static SerializableHmmParameters deserializeFrom(String filename) throws JsonSyntaxException, IOException {
    return fromJson(Files.asCharSource(new File(filename), Charsets.UTF_8).read());
  }

  private static Gson gson() {
    return new GsonBuilder().setPrettyPrinting().create();
  }

}
