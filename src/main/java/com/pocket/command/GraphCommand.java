package com.pocket.command;

import com.pocket.exception.PocketException;
import com.pocket.graph.ShoveGraph;
import picocli.CommandLine.Command;

import java.io.IOException;

/**
 * pocket graph - 以文本图形显示全部 shove 与 timeline。
 */
@Command(name = "graph", mixinStandardHelpOptions = true, description = "显示 shove 图")
public class GraphCommand extends PocketCommand {

    @Override
    protected int execute() throws PocketException, IOException {
        ShoveGraph graph = ShoveGraph.load(openRepository());
        if (graph.size() == 0) {
            System.out.println("no shoves yet");
            return 0;
        }
        System.out.print(graph.render());
        return 0;
    }
}
