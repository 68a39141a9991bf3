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
package org.jenkinsci.jpi.testdeps;

import java.io.File;
import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.io.FileUtils;
import org.jenkinsci.jpi.archive.AssemblyException;
import org.jenkinsci.jpi.artifact.ArtifactClassifier;
import org.jenkinsci.jpi.artifact.ResolvedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lays out plugins for the Jenkins test harness: each plugin archive is
 * copied to <code>test-dependencies/&lt;name&gt;.jpi</code> and the names are
 * listed, one per line, in <code>test-dependencies/index</code>.
 */
public class TestDependenciesWriter {

  private static final Logger LOG = LoggerFactory
      .getLogger(MethodHandles.lookup().lookupClass());

  public static final String DIRECTORY = "test-dependencies";
  public static final String INDEX = "index";

  /**
   * @param artifacts resolved artifacts; anything but plugin archives is
   *          skipped
   * @param outputDir directory receiving <code>test-dependencies</code>
   * @return the plugin names written to the index
   * @throws AssemblyException if a file cannot be written
   */
  public List<String> write(List<ResolvedArtifact> artifacts, File outputDir)
      throws AssemblyException {
    File dir = new File(outputDir, DIRECTORY);
    Map<String, ResolvedArtifact> plugins = new LinkedHashMap<>();
    for (ResolvedArtifact artifact : artifacts) {
      if (ArtifactClassifier.isHostExtension(artifact)) {
        plugins.putIfAbsent(artifact.getModule().getName(), artifact);
      }
    }
    try {
      FileUtils.forceMkdir(dir);
      for (Map.Entry<String, ResolvedArtifact> e : plugins.entrySet()) {
        FileUtils.copyFile(e.getValue().getFile(),
            new File(dir, e.getKey() + "." + ArtifactClassifier.JPI_TYPE));
      }
      List<String> names = new ArrayList<>(plugins.keySet());
      FileUtils.writeLines(new File(dir, INDEX), StandardCharsets.UTF_8.name(),
          names, "\n");
      LOG.info("Wrote {} test dependencies to {}", names.size(), dir);
      return names;
    } catch (IOException e) {
      throw new AssemblyException("Could not write test dependencies to " + dir, e);
    }
  }
}
