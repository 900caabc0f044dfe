/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
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

package com.twentyn.pnm.tools;

import com.twentyn.pnm.config.MixtureDefinitionLoader;
import com.twentyn.pnm.network.ElementType;
import com.twentyn.pnm.phases.PhaseDataException;
import com.twentyn.pnm.phases.mixtures.GenericMixture;
import com.twentyn.pnm.phases.mixtures.MixtureAdvisory;
import com.twentyn.pnm.phases.mixtures.MixtureHealth;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a mixture definition, optionally reconciles its composition, and prints the mixture's health along with
 * any requested properties.
 */
public class MixtureInspector {

  public static final String OPTION_INPUT = "i";
  public static final String OPTION_STRATEGY = "s";
  public static final String OPTION_RELEASE = "r";
  public static final String OPTION_PROPERTY = "p";
  public static final String HELP_MESSAGE =
      "This class loads a mixture from a JSON definition and reports on its composition.";

  public static final String STRATEGY_FREE = "free";
  public static final String STRATEGY_CONCENTRATION = "concentration";
  public static final String STRATEGY_NONE = "none";

  private static final Logger LOGGER = LogManager.getFormatterLogger(MixtureInspector.class);

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_INPUT)
        .argName("input file")
        .desc("A JSON file describing the network, the phases and the mixture")
        .hasArg().required()
        .longOpt("input")
    );
    add(Option.builder(OPTION_STRATEGY)
        .argName("strategy")
        .desc(String.format("How to reconcile the composition before inspection: %s, %s or %s (default)",
            STRATEGY_FREE, STRATEGY_CONCENTRATION, STRATEGY_NONE))
        .hasArg()
        .longOpt("strategy")
    );
    add(Option.builder(OPTION_RELEASE)
        .argName("component")
        .desc("A component whose mole fraction the free component strategy should solve for")
        .hasArg()
        .longOpt("release")
    );
    add(Option.builder(OPTION_PROPERTY)
        .argName("property key")
        .desc("A mixture property to print, e.g. pore.viscosity; may be repeated")
        .hasArgs()
        .longOpt("property")
    );
    add(Option.builder("h")
        .argName("help")
        .desc("Prints this help message")
        .longOpt("help")
    );
  }};
  public static final HelpFormatter HELP_FORMATTER = new HelpFormatter();

  static {
    HELP_FORMATTER.setWidth(100);
  }

  private final PrintStream out;

  public MixtureInspector(PrintStream out) {
    this.out = out;
  }

  public static void main(String[] args) throws Exception {
    int status = run(args, System.out);
    if (status != 0) {
      System.exit(status);
    }
  }

  public static int run(String[] args, PrintStream out) {
    Options opts = new Options();
    for (Option.Builder b : OPTION_BUILDERS) {
      opts.addOption(b.build());
    }

    CommandLine cl;
    try {
      CommandLineParser parser = new DefaultParser();
      cl = parser.parse(opts, args);
    } catch (ParseException e) {
      LOGGER.error("Argument parsing failed: %s", e.getMessage());
      HELP_FORMATTER.printHelp(MixtureInspector.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      return 1;
    }

    if (cl.hasOption("help")) {
      HELP_FORMATTER.printHelp(MixtureInspector.class.getCanonicalName(), HELP_MESSAGE, opts, null, true);
      return 0;
    }

    String strategy = cl.getOptionValue(OPTION_STRATEGY, STRATEGY_NONE);
    if (!StringUtils.equalsAny(strategy, STRATEGY_FREE, STRATEGY_CONCENTRATION, STRATEGY_NONE)) {
      LOGGER.error("Unknown strategy %s", strategy);
      return 1;
    }

    GenericMixture mixture;
    try {
      mixture = new MixtureDefinitionLoader().load(new File(cl.getOptionValue(OPTION_INPUT)));
    } catch (IOException | IllegalArgumentException | PhaseDataException e) {
      LOGGER.error("Unable to load mixture definition: %s", e.getMessage());
      return 1;
    }

    MixtureInspector inspector = new MixtureInspector(out);
    try {
      inspector.reconcile(mixture, strategy, cl.getOptionValue(OPTION_RELEASE));
    } catch (PhaseDataException e) {
      LOGGER.error("Unable to reconcile the composition of %s: %s", mixture.getName(), e.getMessage());
      return 1;
    }
    inspector.report(mixture, cl.getOptionValues(OPTION_PROPERTY));
    return 0;
  }

  public void reconcile(GenericMixture mixture, String strategy, String released) {
    if (STRATEGY_FREE.equals(strategy)) {
      mixture.recomputeFromFreeComponent(ElementType.PORE, released);
    } else if (STRATEGY_CONCENTRATION.equals(strategy)) {
      mixture.recomputeFromConcentrations(ElementType.PORE);
    }
    LOGGER.info("Reconciled %s using strategy %s", mixture.getName(), strategy);
  }

  public void report(GenericMixture mixture, String[] propertyKeys) {
    out.println(String.format("Mixture %s: %s", mixture.getName(),
        StringUtils.join(mixture.listComponents().keySet(), ", ")));

    MixtureHealth health = mixture.checkHealth();
    out.println(String.format("Healthy: %s", health.isHealthy()));
    out.println(String.format("mole_fraction_too_low: %s", health.getTooLow()));
    out.println(String.format("mole_fraction_too_high: %s", health.getTooHigh()));
    out.println(String.format("mole_fraction_undefined: %s", health.getUndefined()));

    for (MixtureAdvisory advisory : mixture.getDiagnostics().drain()) {
      out.println(String.format("Advisory %s", advisory));
    }

    if (propertyKeys == null) {
      return;
    }
    for (String key : propertyKeys) {
      try {
        out.println(String.format("%s: [%s]", key, StringUtils.join(mixture.get(key), ',')));
      } catch (PhaseDataException | IllegalArgumentException e) {
        LOGGER.error("Unable to resolve %s: %s", key, e.getMessage());
        out.println(String.format("%s: unavailable (%s)", key, e.getMessage()));
      }
    }
  }
}
