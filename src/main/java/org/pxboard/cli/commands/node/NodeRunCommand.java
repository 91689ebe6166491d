package org.pxboard.cli.commands.node;

import com.typesafe.config.Config;
import org.pxboard.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the node and serves until the process is terminated."
)
public class NodeRunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeRunCommand.class);

    @ParentCommand
    private NodeCommand parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final Config config = parent.getParent().getConfig(spec.commandLine());
        final Node node = new Node(config);
        node.start();

        // The node's shutdown hook stops the processes.
        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            node.stop();
        }
        LOGGER.info("Node exited");
        return 0;
    }
}
