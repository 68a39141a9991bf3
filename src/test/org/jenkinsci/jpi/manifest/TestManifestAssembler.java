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
package org.jenkinsci.jpi.manifest;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.jar.Attributes;

import org.jenkinsci.jpi.archive.ArchiveTask;
import org.jenkinsci.jpi.artifact.ModuleIdentifier;
import org.jenkinsci.jpi.artifact.ResolvedArtifact;
import org.jenkinsci.jpi.config.ConfigurationException;
import org.jenkinsci.jpi.config.JpiSettings;
import org.jenkinsci.jpi.role.RoleGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TestManifestAssembler {

  private ManifestAssembler assembler;
  private ProjectMetadata metadata;

  @BeforeEach
  public void setUp() {
    assembler = new ManifestAssembler();
    metadata = new ProjectMetadata().setShortName("widget").setVersion("1.0")
        .setGroup("org.example").setCoreVersion("2.222.4")
        .setPluginClass("org.example.WidgetPlugin");
  }

  private static ResolvedArtifact plugin(String name, String version) {
    return new ResolvedArtifact(new ModuleIdentifier("org.jenkins-ci.plugins", name),
        version, "hpi", new File(name + ".hpi"));
  }

  @Test
  public void testAttributesInOrder() throws Exception {
    ManifestAttributes attributes = assembler.assemble(metadata);
    assertEquals(Arrays.asList("Manifest-Version", "Short-Name", "Long-Name",
        "Group-Id", "Plugin-Class", "Extension-Name", "Plugin-Version",
        "Jenkins-Version"), new ArrayList<>(attributes.asMap().keySet()));
    assertEquals("widget", attributes.get(ManifestAssembler.LONG_NAME));
    assertEquals("widget", attributes.get(ManifestAssembler.EXTENSION_NAME));
    assertNull(attributes.get(ManifestAssembler.URL));
    assertNull(attributes.get(ManifestAssembler.PLUGIN_DEPENDENCIES));
  }

  @Test
  public void testMissingShortNameOrVersion() {
    ConfigurationException e = assertThrows(ConfigurationException.class,
        () -> assembler.assemble(new ProjectMetadata().setVersion("1.0")));
    assertTrue(e.getMessage().contains("short name"), e.getMessage());

    e = assertThrows(ConfigurationException.class,
        () -> assembler.assemble(new ProjectMetadata().setShortName("widget")));
    assertTrue(e.getMessage().contains("version"), e.getMessage());
  }

  @Test
  public void testPluginDependencies() throws Exception {
    JpiSettings settings = new JpiSettings(RoleGraph.createDefault());
    settings.setProjectName("widget-plugin");
    settings.setVersion("1.0");
    List<ResolvedArtifact> required = Arrays.asList(plugin("credentials", "1.9.4"),
        plugin("ant", "1.2"));
    List<ResolvedArtifact> optional = Arrays.asList(plugin("git", "3.0"),
        plugin("ant", "1.3"));

    ManifestAttributes attributes = assembler.assemble(
        ProjectMetadata.from(settings, required, optional));

    assertEquals("credentials:1.9.4,ant:1.2,git:3.0;resolution:=optional",
        attributes.get(ManifestAssembler.PLUGIN_DEPENDENCIES));
    assertEquals("widget", attributes.get(ManifestAssembler.SHORT_NAME));
  }

  @Test
  public void testApplyKeepsForeignAttributes() throws Exception {
    ArchiveTask jar = new ArchiveTask("jar");
    ArchiveTask hpi = new ArchiveTask("jpi");
    jar.getManifest().getMainAttributes().putValue("Built-By", "ci");

    ManifestAttributes attributes = assembler.assemble(metadata);
    assembler.apply(attributes, jar, hpi);

    Attributes main = jar.getManifest().getMainAttributes();
    assertEquals("ci", main.getValue("Built-By"));
    assertEquals("widget", main.getValue(ManifestAssembler.SHORT_NAME));
    assertEquals("widget", hpi.getManifest().getMainAttributes()
        .getValue(ManifestAssembler.SHORT_NAME));
    assertEquals(attributes.fingerprint(),
        jar.getInputs().get(ManifestAssembler.MANIFEST_INPUT));
    assertEquals(jar.getInputs(), hpi.getInputs());
  }

  @Test
  public void testFingerprintTracksMetadata() throws Exception {
    String first = assembler.assemble(metadata).fingerprint();
    assertEquals(first, assembler.assemble(metadata).fingerprint());

    metadata.setVersion("1.1");
    String second = assembler.assemble(metadata).fingerprint();
    assertNotEquals(first, second);

    ArchiveTask task = new ArchiveTask("jpi");
    task.inputProperty(ManifestAssembler.MANIFEST_INPUT, first);
    assertFalse(task.isUpToDate(Collections.singletonMap(
        ManifestAssembler.MANIFEST_INPUT, second)));
    assertTrue(task.isUpToDate(Collections.singletonMap(
        ManifestAssembler.MANIFEST_INPUT, first)));
    assertFalse(task.isUpToDate(null));
  }

  @Test
  public void testInvalidAttributeName() {
    assertThrows(IllegalArgumentException.class,
        () -> new ManifestAttributes().put("Not Valid", "x"));
    assertEquals(0, new ManifestAttributes().put("Url", null).size());
  }
}
