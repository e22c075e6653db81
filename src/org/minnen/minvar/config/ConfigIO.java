package org.minnen.minvar.config;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.configuration2.ex.ConversionException;
import org.apache.commons.configuration2.io.FileHandler;
import org.apache.commons.lang3.StringUtils;
import org.minnen.minvar.data.DataException;

/**
 * Reads {@link BacktestConfig} values from Apache Commons Configuration sources.
 *
 * Recognized keys (all optional):
 *
 * <pre>
 * tickers                       = AAPL, MSFT, ...
 * start_year / end_year         = 2010 / 2024
 * estimation_window             = 36
 * step                          = 1
 * constraints.min_weight        = -1.0
 * constraints.max_weight        = 1.0
 * constraints.allow_short       = true
 * constraints.long_only         = false
 * risk_free_rate                = 0.042
 * coverage.min_observations     = 36
 * coverage.max_missing_pct      = 0.10
 * degraded_threshold            = 0.20
 * parallelism                   = 1
 * max_universe_warning          = 250
 * </pre>
 */
public class ConfigIO
{
  /** Classpath resource holding the default settings. */
  public static final String DEFAULT_RESOURCE = "/minvar.properties";

  /** Configure a backtest from the given `config`; missing keys keep the builder defaults. */
  public static BacktestConfig configure(Configuration config) throws DataException
  {
    BacktestConfig.Builder builder = BacktestConfig.builder();
    try {
      if (config.containsKey("tickers")) {
        builder.tickers(StringUtils.split(config.getString("tickers"), ", "));
      }
      if (config.containsKey("start_year") || config.containsKey("end_year")) {
        builder.years(config.getInt("start_year", Integer.MIN_VALUE), config.getInt("end_year", Integer.MAX_VALUE));
      }
      int window = config.getInt("estimation_window", BacktestConfig.Builder.DEFAULT_WINDOW);
      builder.estimationWindow(window);
      builder.step(config.getInt("step", 1));

      double minWeight = config.getDouble("constraints.min_weight", -1.0);
      double maxWeight = config.getDouble("constraints.max_weight", 1.0);
      boolean allowShort = config.getBoolean("constraints.allow_short", minWeight < 0.0);
      boolean longOnly = config.getBoolean("constraints.long_only", !allowShort);
      builder.constraints(new Constraints(minWeight, maxWeight, allowShort, longOnly));

      builder.riskFreeRate(config.getDouble("risk_free_rate", BacktestConfig.Builder.DEFAULT_RISK_FREE));
      builder.coverage(config.getInt("coverage.min_observations", window),
          config.getDouble("coverage.max_missing_pct", BacktestConfig.Builder.DEFAULT_MAX_MISSING));
      builder.degradedThreshold(config.getDouble("degraded_threshold",
          BacktestConfig.Builder.DEFAULT_DEGRADED_THRESHOLD));
      builder.parallelism(config.getInt("parallelism", 1));
      builder.maxUniverseWarning(config.getInt("max_universe_warning",
          BacktestConfig.Builder.DEFAULT_MAX_UNIVERSE_WARNING));
    } catch (ConversionException | IllegalArgumentException e) {
      throw new DataException(String.format("Invalid configuration: %s", e.getMessage()), e);
    }

    BacktestConfig backtestConfig = builder.build();
    backtestConfig.validate();
    return backtestConfig;
  }

  /** Load a backtest config from a properties file. */
  public static BacktestConfig load(File file) throws DataException
  {
    PropertiesConfiguration config = new PropertiesConfiguration();
    try {
      new FileHandler(config).load(file);
    } catch (ConfigurationException e) {
      throw new DataException(String.format("Failed to read config file (%s)", file.getPath()), e);
    }
    return configure(config);
  }

  /** Load the default backtest config bundled with this library. */
  public static BacktestConfig loadDefaults() throws DataException
  {
    try (InputStream in = ConfigIO.class.getResourceAsStream(DEFAULT_RESOURCE)) {
      if (in == null) {
        throw new DataException(String.format("Missing default config resource (%s)", DEFAULT_RESOURCE));
      }
      PropertiesConfiguration config = new PropertiesConfiguration();
      new FileHandler(config).load(in);
      return configure(config);
    } catch (ConfigurationException | IOException e) {
      throw new DataException(String.format("Failed to read default config (%s)", DEFAULT_RESOURCE), e);
    }
  }
}
