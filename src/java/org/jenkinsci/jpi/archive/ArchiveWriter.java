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

import java.io.Closeable;
import java.io.File;
import java.io.IOException;

/**
 * Writes entries into an archive. Paths use <code>/</code> as separator;
 * parent directories are created as needed.
 */
public interface ArchiveWriter extends Closeable {

  /** Adds a directory entry. Adding the same directory twice is harmless. */
  void putDirectory(String path) throws IOException;

  /**
   * @throws IOException if the entry cannot be written or already exists
   */
  void putEntry(String path, byte[] content) throws IOException;

  /**
   * @throws IOException if the file cannot be read, the entry cannot be
   *           written or already exists
   */
  void putFile(String path, File file) throws IOException;

}
