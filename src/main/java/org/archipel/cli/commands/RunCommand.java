package org.archipel.cli.commands;

import com.typesafe.config.Config;
import org.archipel.cli.CommandLineInterface;
import org.archipel.evolution.Model;
import org.archipel.node.ModelSource;
import org.archipel.runner.Report;
import org.archipel.runner.RunOptions;
import org.archipel.runner.Runner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Runs the configured model in this process and prints a summary."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-m", "--model"}, description = "Model provider class (default: archipel.model.provider)")
    private String providerClass;

    @Override
    public Integer call() throws Exception {
        final Config config = parent.getConfig();
        final ModelSource source = ModelCommands.modelSource(config, providerClass);
        final Model model = source.load();
        LOGGER.info("Running {} with {} populations", source.providerClass(), model.numPopulations());

        final Report report = new Runner(config.getConfig("archipel.runner")).run(model, RunOptions.local());
        spec.commandLine().getOut().println(report.formatSummary());
        spec.commandLine().getOut().flush();
        return 0;
    }
}
