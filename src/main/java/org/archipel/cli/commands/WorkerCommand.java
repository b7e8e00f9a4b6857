package org.archipel.cli.commands;

import com.typesafe.config.Config;
import org.archipel.cli.CommandLineInterface;
import org.archipel.node.BootstrapWorker;
import org.archipel.node.Cluster;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "worker",
    description = "Waits for a leader and hosts populations for it until the leader terminates."
)
public class WorkerCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() throws Exception {
        final Config archipel = parent.getConfig().getConfig("archipel");
        try (Cluster cluster = new Cluster(archipel)) {
            cluster.start();
            new BootstrapWorker(cluster.directory(), cluster.client(),
                BootstrapWorker.Options.fromConfig(archipel.getConfig("bootstrap"))).run();
        }
        return 0;
    }
}
