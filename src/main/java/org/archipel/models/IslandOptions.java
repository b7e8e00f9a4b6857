package org.archipel.models;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.archipel.evolution.ConfigurationException;
import org.archipel.migration.EmigrationOptions;
import org.archipel.migration.ITopology;
import org.archipel.migration.ImmigrationOptions;
import org.archipel.migration.TargetCount;
import org.archipel.migration.Topologies;

import java.time.Duration;
import java.util.Map;

/**
 * Island layout options shared by the example models.
 *
 * <pre>
 * populations = 4
 * population-size = 100
 * generations = 100
 * migration {
 *   topology = "ring"
 *   interval = 10
 *   emigrants = 5
 *   blocking = true
 *   timeout = 20s
 * }
 * </pre>
 */
record IslandOptions(int populations, int populationSize, int generations, ITopology topology,
                     int emigrants, EmigrationOptions emigration, ImmigrationOptions immigration) {

    private static final Config DEFAULTS = ConfigFactory.parseMap(Map.of(
        "populations", 4,
        "population-size", 100,
        "generations", 100,
        "migration.topology", "ring",
        "migration.interval", 10,
        "migration.emigrants", 5,
        "migration.blocking", true,
        "migration.timeout", "20s"
    ));

    static IslandOptions fromConfig(Config options) {
        Config config = options.withFallback(DEFAULTS);
        int populations = config.getInt("populations");
        int populationSize = config.getInt("population-size");
        int emigrants = config.getInt("migration.emigrants");
        if (populations < 1 || populationSize < 2) {
            throw new ConfigurationException(String.format(
                "expected at least 1 population of at least 2 individuals, got %d of %d", populations, populationSize));
        }
        if (emigrants < 0 || emigrants > populationSize) {
            throw new ConfigurationException(String.format(
                "expected 0..%d emigrants, got: %d", populationSize, emigrants));
        }
        int interval = config.getInt("migration.interval");
        Duration timeout = config.getDuration("migration.timeout");
        return new IslandOptions(
            populations,
            populationSize,
            config.getInt("generations"),
            Topologies.byName(config.getString("migration.topology")),
            emigrants,
            new EmigrationOptions(interval, TargetCount.exactly(1)),
            new ImmigrationOptions(interval, config.getBoolean("migration.blocking"), timeout));
    }
}
