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
package org.jenkinsci.jpi.util;

import org.apache.hadoop.conf.Configuration;

/** Utility to create Hadoop {@link Configuration}s that include the
 * plugin packaging resources.  */
public class JpiConfiguration {

  private JpiConfiguration() {}                 // singleton

  /** Create a {@link Configuration} for plugin packaging. */
  public static Configuration create() {
    Configuration conf = new Configuration();
    addJpiResources(conf);
    return conf;
  }

  /** Add <code>jpi-default.xml</code> and <code>jpi-site.xml</code> to a
   * {@link Configuration}. A missing site file is ignored. */
  public static Configuration addJpiResources(Configuration conf) {
    conf.addResource("jpi-default.xml");
    conf.addResource("jpi-site.xml");
    return conf;
  }

}
