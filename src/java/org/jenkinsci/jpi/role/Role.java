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
package org.jenkinsci.jpi.role;

/**
 * The fixed set of dependency roles a plugin build knows about. The first
 * group are the Jenkins specific roles, the rest are the Java and war scopes
 * they feed into.
 */
public enum Role {

  /** The Jenkins core the plugin is built against. */
  JENKINS_CORE("jenkinsCore"),
  /** Jenkins plugins the plugin depends on. */
  JENKINS_PLUGINS("jenkinsPlugins"),
  /** Jenkins plugins the plugin optionally depends on. */
  OPTIONAL_JENKINS_PLUGINS("optionalJenkinsPlugins"),
  /** Jenkins plugins installed into a development instance. */
  JENKINS_SERVER("jenkinsServer"),
  /** Jenkins plugins needed only by tests. */
  JENKINS_TEST("jenkinsTest"),
  /** The Jenkins war matching the core, test scope only. */
  JENKINS_WAR("jenkinsWar"),
  /** Every plugin declared on the plugin roles, for the test harness. */
  PLUGIN_RESOURCES("pluginResources"),

  IMPLEMENTATION("implementation"),
  RUNTIME_ONLY("runtimeOnly"),
  PROVIDED_COMPILE("providedCompile"),
  PROVIDED_RUNTIME("providedRuntime"),
  TEST_IMPLEMENTATION("testImplementation"),

  COMPILE_CLASSPATH("compileClasspath"),
  RUNTIME_CLASSPATH("runtimeClasspath"),
  TEST_COMPILE_CLASSPATH("testCompileClasspath");

  private final String roleName;

  Role(String roleName) {
    this.roleName = roleName;
  }

  /** @return the name the role is declared and looked up with */
  public String getRoleName() {
    return roleName;
  }

  /**
   * @param name a role name such as <code>jenkinsPlugins</code>
   * @return the role, or null if no role carries that name
   */
  public static Role forName(String name) {
    for (Role role : values()) {
      if (role.roleName.equals(name)) {
        return role;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return roleName;
  }
}
