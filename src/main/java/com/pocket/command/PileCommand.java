package com.pocket.command;

import com.pocket.exception.PileException;
import com.pocket.exception.PocketException;
import com.pocket.repo.PileEntry;
import com.pocket.repo.Repository;
import com.pocket.repo.RepositoryLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * pocket pile - 把文件加入 pile（暂存区）。支持文件、目录、--all 与 --pattern。
 */
@Command(name = "pile", mixinStandardHelpOptions = true, description = "暂存文件")
public class PileCommand extends PocketCommand {

    private static final Logger log = LoggerFactory.getLogger(PileCommand.class);

    @Parameters(arity = "0..*", paramLabel = "FILE", description = "要暂存的文件或目录")
    private List<String> files = new ArrayList<>();

    @Option(names = {"-a", "--all"}, description = "暂存所有修改、删除与未跟踪的文件")
    private boolean all;

    @Option(names = {"-p", "--pattern"}, paramLabel = "GLOB", description = "暂存匹配 glob 的已变更文件")
    private String pattern;

    @Override
    protected int execute() throws PocketException, IOException {
        Repository repo = openRepository();
        try (RepositoryLock lock = repo.lock()) {
            List<PileEntry> staged;
            if (all) {
                staged = repo.pileAll();
            } else if (pattern != null) {
                staged = repo.pilePattern(pattern);
            } else if (!files.isEmpty()) {
                List<String> paths = new ArrayList<>();
                for (String f : files) {
                    paths.add(toRepoPath(repo, f));
                }
                staged = repo.pile(paths);
            } else {
                throw new PileException("no files specified to add to the pile");
            }
            for (PileEntry e : staged) {
                System.out.println("Added " + e.getPath() + " to the pile (" + StatusCommand.describe(e) + ")");
            }
            if (staged.isEmpty()) {
                System.out.println("Nothing to pile");
            }
            log.info("piled {} path(s)", staged.size());
        }
        return 0;
    }
}
