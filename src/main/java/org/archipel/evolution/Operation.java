package org.archipel.evolution;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A named, immutable transformation of a {@link Population}.
 *
 * <p>Besides its implementation, an operation declares how it interacts with fitness and
 * representations. The declarations must be truthful: the {@link Pipeline} relies on them to
 * evaluate fitness lazily and to reject incompatible compositions before a run starts.</p>
 * <ul>
 *   <li>{@code requiresFitness}: fitness must be present when the operation is applied</li>
 *   <li>{@code invalidatesFitness}: the result's fitness no longer matches its genomes</li>
 *   <li>{@code inRepresentations}: the accepted input representations, or any</li>
 *   <li>{@code outRepresentation}: the representation of the result, or the input's</li>
 * </ul>
 */
public final class Operation {

    /**
     * The behavior of an operation.
     */
    @FunctionalInterface
    public interface Impl {
        /**
         * Transforms the population.
         *
         * @param population The input population.
         * @param context    The ambient data of the worker applying the operation.
         * @return The transformed population.
         * @throws InterruptedException if the operation blocks and the worker is interrupted.
         */
        Population apply(Population population, OperationContext context) throws InterruptedException;
    }

    private final String name;
    private final boolean requiresFitness;
    private final boolean invalidatesFitness;
    private final Set<RepresentationTag> inRepresentations;
    private final RepresentationTag outRepresentation;
    private final Impl impl;

    private Operation(Builder builder) {
        this.name = builder.name;
        this.requiresFitness = builder.requiresFitness;
        this.invalidatesFitness = builder.invalidatesFitness;
        this.inRepresentations = builder.inRepresentations == null
            ? null
            : Collections.unmodifiableSet(new LinkedHashSet<>(builder.inRepresentations));
        this.outRepresentation = builder.outRepresentation;
        this.impl = builder.impl;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String name() {
        return name;
    }

    public boolean requiresFitness() {
        return requiresFitness;
    }

    public boolean invalidatesFitness() {
        return invalidatesFitness;
    }

    /**
     * @return {@code true} if the operation accepts populations of any representation.
     */
    public boolean acceptsAnyRepresentation() {
        return inRepresentations == null;
    }

    /**
     * @return The accepted representations; empty when the operation accepts any.
     */
    public Set<RepresentationTag> inRepresentations() {
        return inRepresentations == null ? Collections.emptySet() : inRepresentations;
    }

    public boolean accepts(RepresentationTag representation) {
        return inRepresentations == null || inRepresentations.contains(representation);
    }

    /**
     * @return The declared output representation, or {@code null} if the operation keeps the
     *         input's representation.
     */
    public RepresentationTag outRepresentation() {
        return outRepresentation;
    }

    public boolean hasOutRepresentation() {
        return outRepresentation != null;
    }

    /**
     * Applies the operation to the population.
     *
     * @param population The input population.
     * @param context    The ambient data of the applying worker.
     * @return The transformed population, carrying the declared output representation if any.
     * @throws MissingFitnessException if the operation requires fitness and none is present.
     * @throws InterruptedException    if the implementation is interrupted while blocking.
     */
    public Population apply(Population population, OperationContext context) throws InterruptedException {
        if (requiresFitness && !population.hasFitness()) {
            throw new MissingFitnessException(name);
        }
        Population result = impl.apply(population, context);
        if (outRepresentation != null) {
            result = result.withRepresentation(outRepresentation);
        }
        return result;
    }

    @Override
    public String toString() {
        return "Operation[" + name + "]";
    }

    /**
     * Builder for {@link Operation}. Defaults: no fitness requirement, no invalidation, any
     * input representation, same output representation.
     */
    public static final class Builder {
        private final String name;
        private boolean requiresFitness;
        private boolean invalidatesFitness;
        private Set<RepresentationTag> inRepresentations;
        private RepresentationTag outRepresentation;
        private Impl impl;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new ConfigurationException("operation name must not be blank");
            }
            this.name = name;
        }

        public Builder requiresFitness(boolean requiresFitness) {
            this.requiresFitness = requiresFitness;
            return this;
        }

        public Builder invalidatesFitness(boolean invalidatesFitness) {
            this.invalidatesFitness = invalidatesFitness;
            return this;
        }

        public Builder anyRepresentation() {
            this.inRepresentations = null;
            return this;
        }

        public Builder inRepresentations(RepresentationTag... representations) {
            return inRepresentations(Set.of(representations));
        }

        public Builder inRepresentations(Set<RepresentationTag> representations) {
            this.inRepresentations = new LinkedHashSet<>(representations);
            return this;
        }

        public Builder sameRepresentation() {
            this.outRepresentation = null;
            return this;
        }

        public Builder outRepresentation(RepresentationTag representation) {
            this.outRepresentation = Objects.requireNonNull(representation, "representation");
            return this;
        }

        public Builder impl(Impl impl) {
            this.impl = impl;
            return this;
        }

        public Operation build() {
            if (impl == null) {
                throw new ConfigurationException(String.format("operation \"%s\" has no implementation", name));
            }
            return new Operation(this);
        }
    }
}
