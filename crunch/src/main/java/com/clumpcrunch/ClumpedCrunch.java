/*************************************************************************
*                                                                        *
*  This file is part of the clumpcrunch project.                         *
*  clumpcrunch standardizes clumped-isotope measurements of CO2.         *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.clumpcrunch;

import com.clumpcrunch.crunch.AnalysisCruncher;
import com.clumpcrunch.crunch.WorkingGasCalibrator;
import com.clumpcrunch.data.ClumpedDataset;
import com.clumpcrunch.data.ClumpedMass;
import com.clumpcrunch.io.AnalysisTableReader;
import com.clumpcrunch.io.ResultTables;
import com.clumpcrunch.io.StandardizationConfig;
import com.clumpcrunch.simulate.EquilibriumAnchors;
import com.clumpcrunch.standardization.SampleSplitter;
import com.clumpcrunch.standardization.StandardizationEngine;
import com.clumpcrunch.standardization.StandardizationMethod;
import com.clumpcrunch.utils.CLIUtil;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a table of raw analyses, crunches and standardizes them, and writes tables of analyses, samples and
 * sessions plus a summary to an output directory.
 */
public class ClumpedCrunch {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ClumpedCrunch.class);

  private static final String DEFAULT_OUTPUT_DIR = "output";

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_CONFIG = "c";
  public static final String OPTION_OUTPUT_DIR = "o";
  public static final String OPTION_METHOD = "m";
  public static final String OPTION_MASS = "x";

  public static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "Standardizes clumped-isotope (D47 or D48) measurements of CO2 against anchor samples,",
      "propagating errors to the absolute anomalies of unknown samples."
  }, " ");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("file")
        .desc("A CSV (comma, semicolon or tab separated) table of raw analyses")
        .hasArg()
        .longOpt("input")
    );
    add(Option.builder(OPTION_CONFIG)
        .argName("file")
        .desc("A JSON file of processing settings")
        .hasArg()
        .longOpt("config")
    );
    add(Option.builder(OPTION_OUTPUT_DIR)
        .argName("directory")
        .desc(String.format("Where to write the result tables (default: %s)", DEFAULT_OUTPUT_DIR))
        .hasArg()
        .longOpt("output-dir")
    );
    add(Option.builder(OPTION_METHOD)
        .argName("method")
        .desc("Standardization method, pooled or indep_sessions; overrides the configuration")
        .hasArg()
        .longOpt("method")
    );
    add(Option.builder(OPTION_MASS)
        .argName("mass")
        .desc("The anomaly to standardize, 47 or 48; overrides the configuration")
        .hasArg()
        .longOpt("mass")
    );
  }};

  private static final CLIUtil CLI_UTIL = new CLIUtil(ClumpedCrunch.class, HELP_MESSAGE, OPTION_BUILDERS);

  public static void main(String[] args) {
    CommandLine cl = CLI_UTIL.parseCommandLine(args);

    if (!cl.hasOption(OPTION_INPUT)) {
      CLI_UTIL.failWithMessage("An input table is required");
    }
    File input = new File(cl.getOptionValue(OPTION_INPUT));
    if (!input.isFile()) {
      CLI_UTIL.failWithMessage("Input file %s does not exist", input.getAbsolutePath());
    }

    try {
      StandardizationConfig config = new StandardizationConfig();
      if (cl.hasOption(OPTION_CONFIG)) {
        config = StandardizationConfig.load(new File(cl.getOptionValue(OPTION_CONFIG)));
      }
      if (cl.hasOption(OPTION_MASS)) {
        config.setMass(cl.getOptionValue(OPTION_MASS));
      }
      if (cl.hasOption(OPTION_METHOD)) {
        config.setMethod(cl.getOptionValue(OPTION_METHOD));
      }
      ClumpedDataset dataset = process(input, config);
      new ResultTables(dataset).writeAll(new File(cl.getOptionValue(OPTION_OUTPUT_DIR, DEFAULT_OUTPUT_DIR)));
    } catch (ClumpedCrunchException e) {
      LOGGER.error("Processing failed: %s", e.getMessage());
      System.exit(1);
    } catch (IOException e) {
      LOGGER.error("I/O error: %s", e.getMessage());
      System.exit(1);
    }
  }

  /**
   * Run the full pipeline on a table of analyses.
   * @return The crunched, standardized and consolidated dataset.
   */
  public static ClumpedDataset process(File input, StandardizationConfig config)
      throws ClumpedCrunchException, IOException {
    ClumpedMass mass = config.getMass();
    ClumpedDataset dataset = new ClumpedDataset(mass);
    config.applyTo(dataset);
    dataset.addAnalyses(new AnalysisTableReader().read(input));
    LOGGER.info("Loaded %d analyses of %d samples in %d sessions", dataset.size(), dataset.getSamples().size(),
        dataset.getSessions().size());

    EquilibriumAnchors.Law law = config.getEquilibriumLaw();
    if (law != null) {
      new EquilibriumAnchors(law).apply(dataset, config.getEquilibriumPriority());
    }
    if (config.isCalibrateWorkingGas()) {
      new WorkingGasCalibrator(dataset).calibrate();
    }
    new AnalysisCruncher(dataset.getIsobarModel()).crunch(dataset);

    SampleSplitter.Grouping grouping = config.getSplitSamples();
    SampleSplitter splitter = new SampleSplitter(dataset);
    if (grouping != null) {
      splitter.splitSamples(config.getSamplesToSplit(), grouping);
    }

    StandardizationMethod method = config.getMethod();
    new StandardizationEngine(dataset, config.getMaxIterations(), config.getMaxEvaluations())
        .standardize(method, config.getWeightedSessions(), config.getConstraints(), config.isConsolidate());

    if (grouping != null) {
      splitter.unsplitSamples();
    }
    return dataset;
  }
}
