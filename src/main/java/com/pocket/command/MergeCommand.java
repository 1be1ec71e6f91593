package com.pocket.command;

import com.pocket.exception.MergeException;
import com.pocket.exception.PocketException;
import com.pocket.merge.MergeConflict;
import com.pocket.merge.MergeEngine;
import com.pocket.merge.MergeResult;
import com.pocket.merge.MergeStrategy;
import com.pocket.repo.Repository;
import com.pocket.repo.RepositoryLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;

/**
 * pocket merge - 把另一个 timeline 合并到当前 timeline；--abort 放弃进行中的合并。
 * 有冲突时退出码为 1。
 */
@Command(name = "merge", mixinStandardHelpOptions = true, description = "合并 timeline")
public class MergeCommand extends PocketCommand {

    private static final Logger log = LoggerFactory.getLogger(MergeCommand.class);

    @Parameters(index = "0", arity = "0..1", paramLabel = "TIMELINE", description = "要合并的 timeline（可为 remote/name）")
    private String name;

    @Option(names = {"-s", "--strategy"}, paramLabel = "STRATEGY",
            description = "auto | fast-forward-only | always-create-shove | ours | theirs")
    private String strategy;

    @Option(names = "--abort", description = "放弃进行中的合并")
    private boolean abort;

    @Override
    protected int execute() throws PocketException, IOException {
        Repository repo = openRepository();
        try (RepositoryLock lock = repo.lock()) {
            MergeEngine engine = new MergeEngine(repo);
            if (abort) {
                engine.abortMerge();
                System.out.println("Merge aborted");
                return 0;
            }
            if (name == null) {
                throw new MergeException("no timeline specified to merge");
            }
            MergeStrategy mergeStrategy;
            try {
                mergeStrategy = strategy == null ? MergeStrategy.AUTO : MergeStrategy.parse(strategy);
            } catch (IllegalArgumentException e) {
                throw new MergeException("unknown merge strategy '" + strategy + "'", e);
            }
            MergeResult result = engine.merge(name, mergeStrategy);
            log.debug("merge result success={} ff={} conflicts={}", result.isSuccess(), result.isFastForward(),
                    result.getConflicts().size());
            return report(result);
        }
    }

    /** 打印合并结果，返回退出码。pull 复用。 */
    static int report(MergeResult result) {
        if (result.isSuccess()) {
            if (result.getMessage() != null) {
                System.out.println(result.getMessage());
            } else if (result.isFastForward()) {
                System.out.println("Fast-forward merge successful");
            } else {
                System.out.println("Merge successful");
            }
            if (result.getNewShove() != null) {
                System.out.println("Merge shove: " + result.getNewShove());
            }
            return 0;
        }
        System.out.println("Merge failed");
        if (result.getMessage() != null) {
            System.out.println(result.getMessage());
        }
        if (result.hasConflicts()) {
            System.out.println("Conflicts:");
            for (MergeConflict c : result.getConflicts()) {
                System.out.println("  " + c.getPath() + (c.isResolved() ? " (resolved)" : ""));
            }
            System.out.println("\nResolve conflicts and then run 'pocket shove' to complete the merge.");
        }
        return 1;
    }
}
