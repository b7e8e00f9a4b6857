package org.archipel.cli.commands;

import org.archipel.node.NodeId;
import picocli.CommandLine.ITypeConverter;
import picocli.CommandLine.TypeConversionException;

/**
 * Parses {@code name@host:port} command line arguments.
 */
public class NodeIdConverter implements ITypeConverter<NodeId> {

    @Override
    public NodeId convert(final String value) {
        try {
            return NodeId.parse(value);
        } catch (final IllegalArgumentException e) {
            throw new TypeConversionException(e.getMessage());
        }
    }
}
