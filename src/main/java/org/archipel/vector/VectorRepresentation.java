package org.archipel.vector;

import org.archipel.evolution.IRepresentationSpec;
import org.archipel.evolution.RepresentationTag;

import java.util.List;

/**
 * Fixed-length vector genomes stored as {@code double[][]} (one row per individual) with
 * {@code double[]} fitness. Binary genomes use the same layout with 0/1 entries.
 */
public final class VectorRepresentation implements IRepresentationSpec {

    private static final long serialVersionUID = 1L;

    public static final VectorRepresentation SPEC = new VectorRepresentation();

    /** Real-valued vectors. */
    public static final RepresentationTag REAL = new RepresentationTag("real", SPEC);

    /** Bit strings. */
    public static final RepresentationTag BINARY = new RepresentationTag("binary", SPEC);

    private VectorRepresentation() {
    }

    @Override
    public int populationSize(Object genomes) {
        return asGenomes(genomes).length;
    }

    @Override
    public Object concatenateGenomes(List<Object> genomes) {
        int total = 0;
        for (Object batch : genomes) {
            total += asGenomes(batch).length;
        }
        double[][] result = new double[total][];
        int offset = 0;
        for (Object batch : genomes) {
            double[][] rows = asGenomes(batch);
            System.arraycopy(rows, 0, result, offset, rows.length);
            offset += rows.length;
        }
        return result;
    }

    @Override
    public Object concatenateFitness(List<Object> fitness) {
        int total = 0;
        for (Object batch : fitness) {
            total += asFitness(batch).length;
        }
        double[] result = new double[total];
        int offset = 0;
        for (Object batch : fitness) {
            double[] values = asFitness(batch);
            System.arraycopy(values, 0, result, offset, values.length);
            offset += values.length;
        }
        return result;
    }

    static double[][] asGenomes(Object genomes) {
        if (!(genomes instanceof double[][] rows)) {
            throw new IllegalArgumentException("expected double[][] genomes, got: "
                + (genomes == null ? "null" : genomes.getClass().getSimpleName()));
        }
        return rows;
    }

    static double[] asFitness(Object fitness) {
        if (!(fitness instanceof double[] values)) {
            throw new IllegalArgumentException("expected double[] fitness, got: "
                + (fitness == null ? "null" : fitness.getClass().getSimpleName()));
        }
        return values;
    }

    private Object readResolve() {
        return SPEC;
    }
}
