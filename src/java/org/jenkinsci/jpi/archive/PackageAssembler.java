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
package org.jenkinsci.jpi.archive;

import java.io.File;
import java.io.FileNotFoundException;
import java.lang.invoke.MethodHandles;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.jar.Manifest;

import org.jenkinsci.jpi.artifact.ArtifactClassifier;
import org.jenkinsci.jpi.artifact.ResolvedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>Assembles the plugin archive:</p>
 * <pre>
 * META-INF/MANIFEST.MF
 * WEB-INF/lib/&lt;shortName&gt;.jar       the plugin's own classes
 * WEB-INF/lib/&lt;name&gt;-&lt;version&gt;.jar   bundled runtime libraries
 * WEB-INF/...                     the license report
 * </pre>
 * <p>Libraries of excluded modules and plugin archives are never bundled.
 * Entries are written in a fixed order with fixed times, so the same inputs
 * give the same bytes.</p>
 */
public class PackageAssembler {

  private static final Logger LOG = LoggerFactory
      .getLogger(MethodHandles.lookup().lookupClass());

  public static final String WEB_INF = "WEB-INF/";
  public static final String LIB_DIR = WEB_INF + "lib/";

  private final ArchiveWriterFactory writers;

  public PackageAssembler(ArchiveWriterFactory writers) {
    this.writers = writers;
  }

  /**
   * @param descriptor archive name, extension and excluded modules
   * @param compiledJar jar of the plugin's own classes and manifest
   * @param manifest manifest of the archive
   * @param runtimeArtifacts resolved runtime artifacts
   * @param licenseDir license report directory, may be null
   * @param destinationDir directory receiving the archive
   * @return the written archive
   * @throws AssemblyException if the archive cannot be written
   */
  public File assemble(PackageDescriptor descriptor, File compiledJar,
      Manifest manifest, Collection<ResolvedArtifact> runtimeArtifacts,
      File licenseDir, File destinationDir) throws AssemblyException {
    if (!compiledJar.isFile()) {
      throw new AssemblyException("Cannot assemble " + descriptor,
          new FileNotFoundException(compiledJar.getPath()));
    }
    String nestedJar = LIB_DIR + descriptor.getLibraryJarName();
    List<ResolvedArtifact> libraries = selectLibraries(descriptor,
        runtimeArtifacts);
    List<String> licenses = licenseDir != null && licenseDir.isDirectory()
        ? ArchiveFiles.listRelative(licenseDir) : Collections.emptyList();

    File archive = new File(destinationDir, descriptor.getArchiveName());
    ArchiveFiles.writeAtomically(archive, writers, writer -> {
      writer.putEntry(ArchiveFiles.MANIFEST_PATH, ArchiveFiles.toBytes(manifest));
      writer.putDirectory(LIB_DIR);
      writer.putFile(nestedJar, compiledJar);
      for (ResolvedArtifact library : libraries) {
        writer.putFile(LIB_DIR + library.getBundleName(), library.getFile());
      }
      for (String license : licenses) {
        writer.putFile(WEB_INF + license, new File(licenseDir, license));
      }
    });
    LOG.info("Assembled {} with {} bundled libraries", archive,
        libraries.size());
    return archive;
  }

  /**
   * @return the artifacts to put into <code>WEB-INF/lib</code>, sorted by
   *         file name, one per file name
   */
  List<ResolvedArtifact> selectLibraries(PackageDescriptor descriptor,
      Collection<ResolvedArtifact> runtimeArtifacts) {
    Map<String, ResolvedArtifact> byName = new TreeMap<>();
    for (ResolvedArtifact artifact : runtimeArtifacts) {
      if (descriptor.isExcluded(artifact.getModule())) {
        LOG.debug("Not bundling provided {}", artifact);
        continue;
      }
      if (ArtifactClassifier.isHostExtension(artifact)) {
        LOG.debug("Not bundling plugin {}", artifact);
        continue;
      }
      String name = artifact.getBundleName();
      if (name.equals(descriptor.getLibraryJarName())) {
        LOG.warn("Not bundling {}: its file name clashes with the plugin jar",
            artifact);
        continue;
      }
      if (byName.putIfAbsent(name, artifact) != null) {
        LOG.debug("Not bundling {} twice", name);
      }
    }
    return new ArrayList<>(byName.values());
  }
}
