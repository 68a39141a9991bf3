/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.jenkinsci.jpi.artifact;

/**
 * Tells Jenkins plugin archives apart from ordinary libraries by their
 * declared packaging type.
 */
public final class ArtifactClassifier {

  /** Legacy type of a plugin archive. */
  public static final String HPI_TYPE = "hpi";

  /** Current type of a plugin archive. */
  public static final String JPI_TYPE = "jpi";

  /** What a resolved artifact is, as far as packaging is concerned. */
  public enum Kind {
    /** A plugin archive, supplied by the host at run time. */
    HOST_EXTENSION,
    /** Any other artifact. */
    ORDINARY_LIBRARY
  }

  private ArtifactClassifier() {
  }

  public static Kind classify(ResolvedArtifact artifact) {
    return isExtensionType(artifact.getType()) ? Kind.HOST_EXTENSION
        : Kind.ORDINARY_LIBRARY;
  }

  public static boolean isHostExtension(ResolvedArtifact artifact) {
    return classify(artifact) == Kind.HOST_EXTENSION;
  }

  public static boolean isExtensionType(String type) {
    return HPI_TYPE.equals(type) || JPI_TYPE.equals(type);
  }
}
