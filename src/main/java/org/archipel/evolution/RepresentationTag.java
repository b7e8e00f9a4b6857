package org.archipel.evolution;

import java.io.Serializable;
import java.util.Objects;

/**
 * Names a genome encoding and carries the {@link IRepresentationSpec} that knows how to handle
 * it. Operations declare the tags they consume and produce, which gives pipelines a small
 * type system checked when a model is built.
 *
 * <p>Two tags are equal when their names and spec classes are equal, so a tag keeps its
 * identity after being serialized to another node.</p>
 *
 * @param name The encoding name, e.g. "real" or "binary".
 * @param spec The capability object for this encoding.
 */
public record RepresentationTag(String name, IRepresentationSpec spec) implements Serializable {

    public RepresentationTag {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(spec, "spec");
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof RepresentationTag tag)) {
            return false;
        }
        return name.equals(tag.name) && spec.getClass().equals(tag.spec.getClass());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, spec.getClass());
    }

    @Override
    public String toString() {
        return spec.getClass().getSimpleName() + ":" + name;
    }
}
