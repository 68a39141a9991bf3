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
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.jenkinsci.jpi.archive.AssemblyException;
import org.jenkinsci.jpi.artifact.ModuleIdentifier;
import org.jenkinsci.jpi.artifact.ResolvedArtifact;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestTestDependenciesWriter {

  @TempDir
  File tmp;

  private ResolvedArtifact artifact(String name, String version, String type)
      throws Exception {
    File f = new File(tmp, "repo/" + name + "-" + version + "." + type);
    FileUtils.writeStringToFile(f, name + ":" + version, StandardCharsets.UTF_8);
    return new ResolvedArtifact(new ModuleIdentifier("org.jenkins-ci.plugins", name),
        version, type, f);
  }

  @Test
  public void testPluginsCopiedAndIndexed() throws Exception {
    File out = new File(tmp, "out");
    List<String> names = new TestDependenciesWriter().write(Arrays.asList(
        artifact("credentials", "1.9.4", "hpi"),
        artifact("secrets", "1.0", "jar"),
        artifact("ant", "1.2", "jpi"),
        artifact("credentials", "2.0", "hpi")), out);

    assertEquals(Arrays.asList("credentials", "ant"), names);
    File dir = new File(out, TestDependenciesWriter.DIRECTORY);
    assertEquals("credentials:1.9.4", FileUtils.readFileToString(
        new File(dir, "credentials.jpi"), StandardCharsets.UTF_8));
    assertTrue(new File(dir, "ant.jpi").isFile());
    assertFalse(new File(dir, "secrets.jpi").exists());
    assertEquals("credentials\nant\n", FileUtils.readFileToString(
        new File(dir, TestDependenciesWriter.INDEX), StandardCharsets.UTF_8));
  }

  @Test
  public void testUnwritableOutput() throws Exception {
    File blocker = new File(tmp, "blocker");
    FileUtils.touch(blocker);
    assertThrows(AssemblyException.class, () -> new TestDependenciesWriter()
        .write(Arrays.asList(artifact("ant", "1.2", "jpi")), blocker));
  }
}
