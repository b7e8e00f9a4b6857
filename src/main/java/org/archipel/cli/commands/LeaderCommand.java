package org.archipel.cli.commands;

import com.typesafe.config.Config;
import org.archipel.cli.CommandLineInterface;
import org.archipel.evolution.Model;
import org.archipel.node.BootstrapLeader;
import org.archipel.node.Cluster;
import org.archipel.node.ModelSource;
import org.archipel.node.NodeId;
import org.archipel.runner.Report;
import org.archipel.runner.RunOptions;
import org.archipel.runner.Runner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "leader",
    description = "Connects to the given worker nodes and runs the configured model across all of them."
)
public class LeaderCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(LeaderCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "<workerNode>", converter = NodeIdConverter.class,
        description = "Worker nodes as name@host:port")
    private List<NodeId> workerNodes;

    @Option(names = {"-m", "--model"}, description = "Model provider class (default: archipel.model.provider)")
    private String providerClass;

    @Override
    public Integer call() throws Exception {
        final Config config = parent.getConfig();
        final Config archipel = config.getConfig("archipel");
        final ModelSource source = ModelCommands.modelSource(config, providerClass);
        final Model model = source.load();

        try (Cluster cluster = new Cluster(archipel)) {
            final NodeId self = cluster.start();
            new BootstrapLeader(cluster.client(), self,
                BootstrapLeader.Options.fromConfig(archipel.getConfig("bootstrap"))).initiate(workerNodes);

            final List<NodeId> nodes = new ArrayList<>();
            nodes.add(self);
            nodes.addAll(workerNodes);
            LOGGER.info("Running {} with {} populations on {} nodes", source.providerClass(), model.numPopulations(), nodes.size());

            final Report report = new Runner(archipel.getConfig("runner"), cluster)
                .run(model, RunOptions.distributed(nodes, source));
            spec.commandLine().getOut().println(report.formatSummary());
            spec.commandLine().getOut().flush();
        }
        return 0;
    }
}
