package org.archipel.evolution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An evolutionary model: a fitness objective plus the lineages of all populations.
 *
 * <p>Models are validated while they are built, so an invalid composition never reaches the
 * runner.</p>
 */
public final class Model {

    private final IObjective objective;
    private final List<Lineage> lineages;

    private Model(IObjective objective, List<Lineage> lineages) {
        this.objective = objective;
        this.lineages = Collections.unmodifiableList(new ArrayList<>(lineages));
    }

    public static Builder builder(IObjective objective) {
        return new Builder(objective);
    }

    public IObjective objective() {
        return objective;
    }

    /**
     * Returns one lineage per population, in population index order. A lineage added with
     * {@code duplicate = k} appears {@code k} times.
     *
     * @return The expanded lineages.
     */
    public List<Lineage> populations() {
        return lineages;
    }

    public int numPopulations() {
        return lineages.size();
    }

    public static final class Builder {
        private final IObjective objective;
        private final List<Lineage> lineages = new ArrayList<>();

        private Builder(IObjective objective) {
            if (objective == null) {
                throw new ConfigurationException("a model needs an objective");
            }
            this.objective = objective;
        }

        public Builder addPopulation(Operation initializer, Pipeline pipeline) {
            return addPopulation(initializer, pipeline, 1);
        }

        /**
         * Adds {@code duplicate} populations sharing the same definition.
         *
         * @throws InvalidInitializerException    if the initializer declares no output representation.
         * @throws RepresentationMismatchException if the pipeline does not fit the initializer's output.
         */
        public Builder addPopulation(Operation initializer, Pipeline pipeline, int duplicate) {
            if (duplicate < 1) {
                throw new ConfigurationException("duplicate must be at least 1, got: " + duplicate);
            }
            if (!initializer.hasOutRepresentation()) {
                throw new InvalidInitializerException(initializer.name());
            }
            pipeline.validate(initializer.outRepresentation());

            Lineage lineage = new Lineage(initializer, pipeline);
            for (int i = 0; i < duplicate; i++) {
                lineages.add(lineage);
            }
            return this;
        }

        public Model build() {
            if (lineages.isEmpty()) {
                throw new ConfigurationException("a model needs at least one population");
            }
            return new Model(objective, lineages);
        }
    }
}
