package org.archipel.models;

import com.typesafe.config.ConfigFactory;
import org.archipel.evolution.ConfigurationException;
import org.archipel.evolution.Model;
import org.archipel.migration.InvalidTopologyException;
import org.archipel.vector.VectorRepresentation;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class ModelProvidersTest {

    @Test
    void oneMax_usesDefaults() {
        Model model = new OneMaxModelProvider().createModel(ConfigFactory.empty());

        assertThat(model.numPopulations()).isEqualTo(4);
        assertThat(model.populations().get(0).initializer().outRepresentation()).isEqualTo(VectorRepresentation.BINARY);
    }

    @Test
    void oneMax_countsOnes() {
        double[] fitness = (double[]) OneMaxModelProvider.ONE_MAX.evaluate(new double[][]{{1, 0, 1}, {0, 0, 0}});

        assertThat(fitness).containsExactly(2, 0);
    }

    @Test
    void rastrigin_peaksAtOrigin() {
        double[] fitness = (double[]) RastriginModelProvider.RASTRIGIN.evaluate(new double[][]{{0, 0}, {1, 1}});

        assertThat(fitness[0]).isCloseTo(0.0, within(1e-9));
        assertThat(fitness[1]).isLessThan(fitness[0]);
    }

    @Test
    void rastrigin_readsOptions() {
        Model model = new RastriginModelProvider().createModel(ConfigFactory.parseString(
            "populations = 2, population-size = 8, dimensions = 2, migration.topology = star"));

        assertThat(model.numPopulations()).isEqualTo(2);
        assertThat(model.populations().get(1).initializer().outRepresentation()).isEqualTo(VectorRepresentation.REAL);
    }

    @Test
    void islandOptions_rejectInvalidValues() {
        assertThatThrownBy(() -> IslandOptions.fromConfig(ConfigFactory.parseString("population-size = 4, migration.emigrants = 5")))
            .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> IslandOptions.fromConfig(ConfigFactory.parseString("migration.topology = torus")))
            .isInstanceOf(InvalidTopologyException.class);
    }
}
