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
import java.util.List;
import java.util.jar.Manifest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Packs the plugin's compiled classes and resources into the jar that is
 * nested inside the plugin archive.
 */
public class LibraryJarAssembler {

  private static final Logger LOG = LoggerFactory
      .getLogger(MethodHandles.lookup().lookupClass());

  private final ArchiveWriterFactory writers;

  public LibraryJarAssembler(ArchiveWriterFactory writers) {
    this.writers = writers;
  }

  /**
   * @param classesDir compiled classes and resources
   * @param manifest manifest of the jar; a manifest inside
   *          <code>classesDir</code> is ignored
   * @param destination the jar to write
   * @return <code>destination</code>
   * @throws AssemblyException if the jar cannot be written
   */
  public File assemble(File classesDir, Manifest manifest, File destination)
      throws AssemblyException {
    if (!classesDir.isDirectory()) {
      throw new AssemblyException("Cannot assemble " + destination,
          new FileNotFoundException(classesDir.getPath()));
    }
    List<String> files = ArchiveFiles.listRelative(classesDir);
    files.remove(ArchiveFiles.MANIFEST_PATH);
    ArchiveFiles.writeAtomically(destination, writers, writer -> {
      writer.putEntry(ArchiveFiles.MANIFEST_PATH, ArchiveFiles.toBytes(manifest));
      for (String file : files) {
        writer.putFile(file, new File(classesDir, file));
      }
    });
    LOG.info("Assembled {} with {} entries", destination, files.size());
    return destination;
  }
}
