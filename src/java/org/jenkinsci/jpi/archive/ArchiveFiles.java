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

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.jar.Attributes;
import java.util.jar.Manifest;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.filefilter.TrueFileFilter;

/**
 * Helpers shared by the archive assemblers.
 */
final class ArchiveFiles {

  static final String MANIFEST_PATH = "META-INF/MANIFEST.MF";

  /** Content of an archive, written through an {@link ArchiveWriter}. */
  interface Content {
    void writeTo(ArchiveWriter writer) throws IOException;
  }

  private ArchiveFiles() {
  }

  /**
   * Writes an archive to a temporary file next to <code>destination</code>
   * and moves it into place once complete. On failure the temporary file is
   * removed and <code>destination</code> is left untouched.
   */
  static File writeAtomically(File destination, ArchiveWriterFactory factory,
      Content content) throws AssemblyException {
    File dir = destination.getAbsoluteFile().getParentFile();
    File temp = null;
    boolean done = false;
    try {
      FileUtils.forceMkdir(dir);
      temp = File.createTempFile(destination.getName() + ".", ".tmp", dir);
      try (ArchiveWriter writer = factory.create(temp)) {
        content.writeTo(writer);
      }
      move(temp, destination);
      done = true;
      return destination;
    } catch (IOException e) {
      throw new AssemblyException("Could not write " + destination, e);
    } finally {
      if (!done && temp != null) {
        FileUtils.deleteQuietly(temp);
      }
    }
  }

  static byte[] toBytes(Manifest manifest) throws IOException {
    Manifest copy = new Manifest(manifest);
    Attributes main = copy.getMainAttributes();
    if (main.getValue(Attributes.Name.MANIFEST_VERSION) == null) {
      main.put(Attributes.Name.MANIFEST_VERSION, "1.0");
    }
    ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    copy.write(bytes);
    return bytes.toByteArray();
  }

  /**
   * @return the regular files below <code>dir</code> as <code>/</code>
   *         separated relative paths, sorted
   */
  static List<String> listRelative(File dir) {
    List<String> paths = new ArrayList<>();
    String root = dir.getAbsolutePath();
    for (File file : FileUtils.listFiles(dir, TrueFileFilter.INSTANCE,
        TrueFileFilter.INSTANCE)) {
      String relative = file.getAbsolutePath().substring(root.length() + 1);
      paths.add(relative.replace(File.separatorChar, '/'));
    }
    Collections.sort(paths);
    return paths;
  }

  private static void move(File source, File target) throws IOException {
    try {
      Files.move(source.toPath(), target.toPath(),
          StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      Files.move(source.toPath(), target.toPath(),
          StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
