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

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.jar.Attributes;
import java.util.jar.Manifest;

import org.apache.commons.io.FileUtils;
import org.jenkinsci.jpi.archive.AssemblyException;
import org.jenkinsci.jpi.manifest.ManifestAttributes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestTestHplWriter {

  @TempDir
  File tmp;

  private Attributes read(File hpl) throws Exception {
    try (InputStream in = FileUtils.openInputStream(hpl)) {
      return new Manifest(in).getMainAttributes();
    }
  }

  @Test
  public void testAttributesResourcePathAndLibraries() throws Exception {
    ManifestAttributes attributes = new ManifestAttributes()
        .put("Short-Name", "widget")
        .put("Plugin-Version", "1.0");
    File classes = new File(tmp, "classes");
    File junit = new File(tmp, "repo/junit-4.12.jar");
    File webapp = new File(tmp, "src/main/webapp");

    File hpl = new TestHplWriter().write(attributes, webapp,
        Arrays.asList(classes, junit), new File(tmp, "generated"));

    assertEquals(new File(tmp, "generated/the.hpl"), hpl);
    Attributes main = read(hpl);
    assertEquals("1.0", main.getValue(Attributes.Name.MANIFEST_VERSION));
    assertEquals("widget", main.getValue("Short-Name"));
    assertEquals("1.0", main.getValue("Plugin-Version"));
    assertEquals(webapp.getAbsolutePath(), main.getValue(TestHplWriter.RESOURCE_PATH));
    assertEquals(classes.getAbsolutePath() + "," + junit.getAbsolutePath(),
        main.getValue(TestHplWriter.LIBRARIES));
  }

  @Test
  public void testNoResourceDir() throws Exception {
    File hpl = new TestHplWriter().write(
        new ManifestAttributes().put("Short-Name", "widget"), null,
        Collections.<File>emptyList(), tmp);

    Attributes main = read(hpl);
    assertNull(main.getValue(TestHplWriter.RESOURCE_PATH));
    assertEquals("", main.getValue(TestHplWriter.LIBRARIES));
  }

  @Test
  public void testUnwritableOutput() throws Exception {
    File blocker = new File(tmp, "blocker");
    FileUtils.writeStringToFile(blocker, "file", StandardCharsets.UTF_8);
    AssemblyException e = assertThrows(AssemblyException.class,
        () -> new TestHplWriter().write(new ManifestAttributes(), null,
            Collections.<File>emptyList(), blocker));
    assertTrue(e.getMessage().contains("the.hpl"), e.getMessage());
  }
}
