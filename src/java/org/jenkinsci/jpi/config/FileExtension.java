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
package org.jenkinsci.jpi.config;

import java.util.Locale;

/** The two accepted plugin archive extensions. */
public enum FileExtension {

  HPI("hpi"), JPI("jpi");

  private final String extension;

  FileExtension(String extension) {
    this.extension = extension;
  }

  public String getExtension() {
    return extension;
  }

  /**
   * @param value <code>hpi</code> or <code>jpi</code>, case insensitive;
   *          null or empty selects the default
   * @throws ConfigurationException for any other value
   */
  public static FileExtension parse(String value) throws ConfigurationException {
    if (value == null || value.trim().isEmpty()) {
      return HPI;
    }
    String v = value.trim().toLowerCase(Locale.ROOT);
    for (FileExtension e : values()) {
      if (e.extension.equals(v)) {
        return e;
      }
    }
    throw new ConfigurationException("Unsupported file extension '" + value
        + "', expected hpi or jpi");
  }

  @Override
  public String toString() {
    return extension;
  }
}
