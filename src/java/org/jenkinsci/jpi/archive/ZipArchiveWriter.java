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
import java.io.IOException;
import java.nio.file.Files;
import java.util.Calendar;
import java.util.GregorianCalendar;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.compress.archivers.zip.UnixStat;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;

/**
 * Reproducible zip writer. Every entry gets the same modification time and
 * fixed permissions, so equal content written in equal order gives equal
 * bytes.
 */
public class ZipArchiveWriter implements ArchiveWriter {

  /** Modification time of every entry. */
  public static final long CONSTANT_TIME = new GregorianCalendar(1980,
      Calendar.FEBRUARY, 1, 0, 0, 0).getTimeInMillis();

  public static final ArchiveWriterFactory FACTORY = ZipArchiveWriter::new;

  private static final int DIR_MODE = UnixStat.DIR_FLAG | 0755;
  private static final int FILE_MODE = UnixStat.FILE_FLAG | 0644;

  private final ZipArchiveOutputStream out;
  private final Set<String> names = new HashSet<>();

  public ZipArchiveWriter(File file) throws IOException {
    this.out = new ZipArchiveOutputStream(file);
    this.out.setEncoding("UTF-8");
  }

  @Override
  public void putDirectory(String path) throws IOException {
    String dir = path.endsWith("/") ? path : path + "/";
    if (names.contains(dir)) {
      return;
    }
    putParents(dir);
    names.add(dir);
    ZipArchiveEntry entry = new ZipArchiveEntry(dir);
    entry.setTime(CONSTANT_TIME);
    entry.setUnixMode(DIR_MODE);
    out.putArchiveEntry(entry);
    out.closeArchiveEntry();
  }

  @Override
  public void putEntry(String path, byte[] content) throws IOException {
    ZipArchiveEntry entry = newFileEntry(path, content.length);
    out.putArchiveEntry(entry);
    out.write(content);
    out.closeArchiveEntry();
  }

  @Override
  public void putFile(String path, File file) throws IOException {
    ZipArchiveEntry entry = newFileEntry(path, file.length());
    out.putArchiveEntry(entry);
    Files.copy(file.toPath(), out);
    out.closeArchiveEntry();
  }

  @Override
  public void close() throws IOException {
    out.close();
  }

  private ZipArchiveEntry newFileEntry(String path, long size) throws IOException {
    if (!names.add(path)) {
      throw new IOException("Duplicate archive entry " + path);
    }
    putParents(path);
    ZipArchiveEntry entry = new ZipArchiveEntry(path);
    entry.setTime(CONSTANT_TIME);
    entry.setUnixMode(FILE_MODE);
    entry.setSize(size);
    return entry;
  }

  private void putParents(String path) throws IOException {
    String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    int slash = trimmed.lastIndexOf('/');
    if (slash > 0) {
      putDirectory(trimmed.substring(0, slash + 1));
    }
  }
}
