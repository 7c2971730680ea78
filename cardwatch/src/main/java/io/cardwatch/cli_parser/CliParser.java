package io.cardwatch.cli_parser;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

public class CliParser {
  private String configFilePath;
  private String configYamlString;
  private Integer intervalMinutes;
  private boolean singleCheck = false;
  private static final String PATH_OPTION = "p";
  private static final String CONFIG_OPTION = "c";
  private static final String INTERVAL_OPTION = "i";
  private static final String TEST_OPTION = "t";
  private static final String HELP_OPTION = "h";
  private boolean helpRequested = false;

  public void parse(String[] args) throws ParseException {
    Options options = new Options();

    Option pathOption =
        Option.builder(PATH_OPTION)
            .longOpt("path")
            .hasArg()
            .desc("The file path to the configuration file")
            .build();
    options.addOption(pathOption);

    Option configOption =
        Option.builder(CONFIG_OPTION)
            .longOpt("config")
            .hasArg()
            .desc("The YAML configuration string")
            .build();
    options.addOption(configOption);

    Option intervalOption =
        Option.builder(INTERVAL_OPTION)
            .longOpt("interval")
            .hasArg()
            .desc("Minutes to wait between two checks (default: 5)")
            .build();
    options.addOption(intervalOption);

    Option testOption =
        Option.builder(TEST_OPTION)
            .longOpt("test")
            .desc("Run a single check and exit")
            .build();
    options.addOption(testOption);

    Option helpOption =
        Option.builder(HELP_OPTION).longOpt("help").desc("Display help information").build();
    options.addOption(helpOption);

    CommandLineParser parser = new DefaultParser();
    CommandLine cmd = parser.parse(options, args);

    if (cmd.hasOption(HELP_OPTION)) {
      HelpFormatter formatter = new HelpFormatter();
      helpRequested = true;
      formatter.printHelp("cardwatch answer card monitor", options);
      return;
    }

    if (cmd.hasOption(PATH_OPTION) && cmd.hasOption(CONFIG_OPTION)) {
      throw new ParseException("Cannot specify both a file path and a config string.");
    }

    if (cmd.hasOption(PATH_OPTION)) {
      configFilePath = cmd.getOptionValue(PATH_OPTION);
    }

    if (cmd.hasOption(CONFIG_OPTION)) {
      configYamlString = cmd.getOptionValue(CONFIG_OPTION);
    }

    if (cmd.hasOption(INTERVAL_OPTION)) {
      intervalMinutes = parseInterval(cmd.getOptionValue(INTERVAL_OPTION));
    }

    singleCheck = cmd.hasOption(TEST_OPTION);
  }

  private static int parseInterval(String value) throws ParseException {
    int minutes;
    try {
      minutes = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ParseException("Interval must be a whole number of minutes: " + value);
    }
    if (minutes <= 0) {
      throw new ParseException("Interval must be a positive number of minutes: " + value);
    }
    return minutes;
  }

  public boolean isHelpRequested() {
    return helpRequested;
  }

  public String getConfigFilePath() {
    return configFilePath;
  }

  public String getConfigYamlString() {
    return configYamlString;
  }

  /** The interval given on the command line, or null to keep the configured one. */
  public Integer getIntervalMinutes() {
    return intervalMinutes;
  }

  public boolean isSingleCheck() {
    return singleCheck;
  }
}
