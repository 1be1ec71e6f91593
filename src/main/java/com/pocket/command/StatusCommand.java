package com.pocket.command;

import com.pocket.exception.PocketException;
import com.pocket.repo.PileEntry;
import com.pocket.repo.RepoStatus;
import com.pocket.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;

/**
 * pocket status - 显示当前 timeline、已暂存、已修改、已删除、未跟踪的文件以及未解决的冲突。
 */
@Command(name = "status", mixinStandardHelpOptions = true, description = "显示工作区状态")
public class StatusCommand extends PocketCommand {

    private static final Logger log = LoggerFactory.getLogger(StatusCommand.class);

    @Option(names = {"-v", "--verbose"}, description = "显示暂存内容的对象 id")
    private boolean verbose;

    @Override
    protected int execute() throws PocketException, IOException {
        Repository repo = openRepository();
        RepoStatus status = repo.status();
        log.debug("status piled={} modified={} deleted={} untracked={} conflicts={}",
                status.getPiledEntries().size(), status.getModifiedFiles().size(), status.getDeletedFiles().size(),
                status.getUntrackedFiles().size(), status.getConflicts().size());

        System.out.println("On timeline: " + status.getCurrentTimeline());
        if (status.getHeadShove() != null) {
            System.out.println("Head shove: " + status.getHeadShove());
        } else {
            System.out.println("No shoves yet");
        }
        if (status.isStalePile()) {
            System.out.println("\nwarning: the pile was built on an older head; unpile and pile your changes again");
        }

        if (!status.getPiledEntries().isEmpty()) {
            System.out.println("\nChanges to be shoved:");
            for (PileEntry e : status.getPiledEntries()) {
                String line = "  " + describe(e) + ": " + e.getPath();
                if (verbose && e.getObjectId() != null) {
                    line += " (" + e.getObjectId().shortHex() + ")";
                }
                System.out.println(line);
            }
        }
        if (!status.getModifiedFiles().isEmpty() || !status.getDeletedFiles().isEmpty()) {
            System.out.println("\nChanges not piled:");
            for (String path : status.getModifiedFiles()) {
                System.out.println("  modified: " + path);
            }
            for (String path : status.getDeletedFiles()) {
                System.out.println("  deleted: " + path);
            }
        }
        if (!status.getUntrackedFiles().isEmpty()) {
            System.out.println("\nUntracked files:");
            for (String path : status.getUntrackedFiles()) {
                System.out.println("  " + path);
            }
        }
        if (!status.getConflicts().isEmpty()) {
            System.out.println("\nConflicts:");
            for (String path : status.getConflicts()) {
                System.out.println("  conflict: " + path);
            }
            System.out.println("\nResolve conflicts and then run 'pocket shove' to complete the merge.");
        }
        if (status.isClean() && status.getUntrackedFiles().isEmpty()) {
            System.out.println("\nnothing to shove, working tree clean");
        }
        return 0;
    }

    static String describe(PileEntry e) {
        switch (e.getStatus()) {
            case ADDED:
                return "new file";
            case DELETED:
                return "deleted";
            case RENAMED:
                return "renamed from " + e.getOriginalPath();
            default:
                return "modified";
        }
    }
}
