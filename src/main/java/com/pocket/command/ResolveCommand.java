package com.pocket.command;

import com.pocket.exception.PocketException;
import com.pocket.merge.ConflictResolution;
import com.pocket.merge.MergeEngine;
import com.pocket.repo.Repository;
import com.pocket.repo.RepositoryLock;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;

/**
 * pocket resolve - 用 ours 或 theirs 的版本解决合并冲突。
 * 手工编辑后的文件直接 pile 即视为已解决。
 */
@Command(name = "resolve", mixinStandardHelpOptions = true, description = "解决合并冲突")
public class ResolveCommand extends PocketCommand {

    @Parameters(index = "0", paramLabel = "PATH")
    private String path;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Side side;

    static class Side {
        @Option(names = "--ours", required = true, description = "使用当前 timeline 的版本")
        boolean ours;

        @Option(names = "--theirs", required = true, description = "使用被合并 timeline 的版本")
        boolean theirs;
    }

    @Override
    protected int execute() throws PocketException, IOException {
        Repository repo = openRepository();
        try (RepositoryLock lock = repo.lock()) {
            String rel = toRepoPath(repo, path);
            ConflictResolution resolution = side.ours ? ConflictResolution.useOurs() : ConflictResolution.useTheirs();
            new MergeEngine(repo).resolve(rel, resolution);
            System.out.println("Resolved " + rel + " using " + (side.ours ? "ours" : "theirs"));
        }
        return 0;
    }
}
