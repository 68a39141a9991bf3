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
package org.jenkinsci.jpi;

import java.io.File;
import java.lang.invoke.MethodHandles;
import java.text.SimpleDateFormat;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.hadoop.conf.Configured;
import org.apache.hadoop.util.Tool;
import org.apache.hadoop.util.ToolRunner;
import org.jenkinsci.jpi.archive.ZipArchiveWriter;
import org.jenkinsci.jpi.config.JpiSettings;
import org.jenkinsci.jpi.resolve.FlatDirResolver;
import org.jenkinsci.jpi.util.JpiConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point. Plugin metadata and role dependencies come from
 * the configuration (<code>jpi-site.xml</code> or <code>-D</code> options),
 * artifacts from a flat directory.
 */
public class JpiPackager extends Configured implements Tool {

  private static final Logger LOG = LoggerFactory
      .getLogger(MethodHandles.lookup().lookupClass());

  @SuppressWarnings("static-access")
  public int run(String[] args) throws Exception {
    Option helpOpt = new Option("h", "help", false, "Show this message");
    Option classesOpt = OptionBuilder.withArgName("classes")
        .isRequired()
        .withDescription("Directory of compiled classes and resources")
        .hasArg()
        .create("classes");
    Option repoOpt = OptionBuilder.withArgName("repo")
        .isRequired()
        .withDescription("Flat directory holding all dependency artifacts")
        .hasArg()
        .create("repo");
    Option outOpt = OptionBuilder.withArgName("outDir")
        .isRequired()
        .withDescription("Output directory for the plugin jar and archive")
        .hasArg()
        .create("outDir");
    Option licensesOpt = OptionBuilder.withArgName("licenses")
        .withDescription("Optional license report directory, copied into WEB-INF")
        .hasArg()
        .create("licenses");
    Option testDepsOpt = OptionBuilder.withArgName("testDependencies")
        .withDescription("Optional directory receiving test-dependencies/")
        .hasArg()
        .create("testDependencies");
    Option testHplOpt = OptionBuilder.withArgName("testHpl")
        .withDescription("Optional directory receiving the test harness manifest")
        .hasArg()
        .create("testHpl");
    Option webappOpt = OptionBuilder.withArgName("webapp")
        .withDescription("Optional web resources directory named in the test harness manifest")
        .hasArg()
        .create("webapp");

    Options options = new Options();
    options.addOption(helpOpt);
    options.addOption(classesOpt);
    options.addOption(repoOpt);
    options.addOption(outOpt);
    options.addOption(licensesOpt);
    options.addOption(testDepsOpt);
    options.addOption(testHplOpt);
    options.addOption(webappOpt);

    CommandLineParser parser = new GnuParser();
    CommandLine cli;
    try {
      cli = parser.parse(options, args);
    } catch (ParseException e) {
      System.err.println(e.getMessage());
      new HelpFormatter().printHelp("JpiPackager", options, true);
      return -1;
    }
    if (cli.hasOption("help")) {
      new HelpFormatter().printHelp("JpiPackager", options, true);
      return 0;
    }

    SimpleDateFormat sdf = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss");
    long start = System.currentTimeMillis();
    LOG.info("JpiPackager: starting at {}", sdf.format(start));

    try {
      JpiSettings settings = JpiSettings.fromConfiguration(getConf());
      JpiPackaging packaging = new JpiPackaging(settings,
          new FlatDirResolver(new File(cli.getOptionValue("repo"))),
          ZipArchiveWriter.FACTORY);
      File licenses = cli.hasOption("licenses")
          ? new File(cli.getOptionValue("licenses")) : null;
      File archive = packaging.packageInto(
          new File(cli.getOptionValue("classes")), licenses,
          new File(cli.getOptionValue("outDir")));
      LOG.info("JpiPackager: wrote {}", archive);
      if (cli.hasOption("testDependencies")) {
        packaging.writeTestDependencies(
            new File(cli.getOptionValue("testDependencies")));
      }
      if (cli.hasOption("testHpl")) {
        File webapp = cli.hasOption("webapp")
            ? new File(cli.getOptionValue("webapp")) : null;
        packaging.writeTestHpl(new File(cli.getOptionValue("classes")),
            webapp, new File(cli.getOptionValue("testHpl")));
      }
    } catch (JpiException e) {
      LOG.error("JpiPackager: {}", e.getMessage());
      return -1;
    }

    long end = System.currentTimeMillis();
    LOG.info("JpiPackager: finished at {}, elapsed: {} ms", sdf.format(end),
        end - start);
    return 0;
  }

  public static void main(String[] args) throws Exception {
    int res = ToolRunner.run(JpiConfiguration.create(), new JpiPackager(), args);
    System.exit(res);
  }
}
