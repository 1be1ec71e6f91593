package com.pocket.command;

import com.pocket.exception.PileException;
import com.pocket.exception.PocketException;
import com.pocket.repo.PileEntry;
import com.pocket.repo.Repository;
import com.pocket.repo.RepositoryLock;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * pocket unpile - 从 pile 中移除文件，工作区不受影响。
 */
@Command(name = "unpile", mixinStandardHelpOptions = true, description = "取消暂存")
public class UnpileCommand extends PocketCommand {

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "要取消暂存的文件或目录")
    private List<String> files = new ArrayList<>();

    @Option(names = {"-a", "--all"}, description = "清空 pile")
    private boolean all;

    @Override
    protected int execute() throws PocketException, IOException {
        Repository repo = openRepository();
        try (RepositoryLock lock = repo.lock()) {
            if (all) {
                int count = repo.unpileAll();
                System.out.println("Removed " + count + " file(s) from the pile");
                return 0;
            }
            if (files.isEmpty()) {
                throw new PileException("no files specified to remove from the pile");
            }
            List<String> paths = new ArrayList<>();
            for (String f : files) {
                paths.add(toRepoPath(repo, f));
            }
            for (PileEntry e : repo.unpile(paths)) {
                System.out.println("Removed " + e.getPath() + " from the pile");
            }
        }
        return 0;
    }
}
