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
import java.io.OutputStream;
import java.lang.invoke.MethodHandles;
import java.util.List;
import java.util.Map;
import java.util.jar.Attributes;
import java.util.jar.Manifest;

import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.StringUtils;
import org.jenkinsci.jpi.archive.AssemblyException;
import org.jenkinsci.jpi.manifest.ManifestAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the plugin manifest the Jenkins test harness loads the plugin under
 * test from. Besides the plugin attributes it names the web resources in
 * <code>Resource-Path</code> and the class path entries in
 * <code>Libraries</code>, so the harness runs the plugin without an archive.
 */
public class TestHplWriter {

  private static final Logger LOG = LoggerFactory
      .getLogger(MethodHandles.lookup().lookupClass());

  public static final String FILE_NAME = "the.hpl";
  public static final String RESOURCE_PATH = "Resource-Path";
  public static final String LIBRARIES = "Libraries";

  /**
   * @param attributes plugin manifest attributes
   * @param resourceDir web resources of the plugin, left out when null
   * @param libraries class path entries, in order
   * @param outputDir directory receiving {@link #FILE_NAME}
   * @return the written file
   * @throws AssemblyException if the file cannot be written
   */
  public File write(ManifestAttributes attributes, File resourceDir,
      List<File> libraries, File outputDir) throws AssemblyException {
    Manifest manifest = new Manifest();
    Attributes main = manifest.getMainAttributes();
    main.put(Attributes.Name.MANIFEST_VERSION, "1.0");
    for (Map.Entry<String, String> e : attributes.asMap().entrySet()) {
      main.putValue(e.getKey(), e.getValue());
    }
    if (resourceDir != null) {
      main.putValue(RESOURCE_PATH, resourceDir.getAbsolutePath());
    }
    String[] paths = new String[libraries.size()];
    for (int i = 0; i < paths.length; i++) {
      paths[i] = libraries.get(i).getAbsolutePath();
    }
    main.putValue(LIBRARIES, StringUtils.join(paths, ','));

    File hpl = new File(outputDir, FILE_NAME);
    try (OutputStream out = FileUtils.openOutputStream(hpl)) {
      manifest.write(out);
    } catch (IOException e) {
      throw new AssemblyException("Could not write " + hpl, e);
    }
    LOG.info("Wrote test manifest with {} libraries to {}", paths.length, hpl);
    return hpl;
  }
}
