package com.pocket.command;

import com.pocket.diff.DiffEngine;
import com.pocket.diff.DiffOptions;
import com.pocket.exception.PocketException;
import com.pocket.graph.ShoveGraph;
import com.pocket.obj.FileChange;
import com.pocket.obj.Shove;
import com.pocket.repo.Repository;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * pocket log - 沿第一父链显示 timeline 的历史。
 */
@Command(name = "log", mixinStandardHelpOptions = true, description = "显示 shove 历史")
public class LogCommand extends PocketCommand {

    static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("EEE MMM d HH:mm:ss yyyy Z", Locale.ROOT).withZone(ZoneId.systemDefault());

    @Option(names = {"-v", "--verbose"}, description = "显示每个 shove 的文件变化与 diff")
    private boolean verbose;

    @Option(names = {"-t", "--timeline"}, paramLabel = "NAME", description = "要查看的 timeline，默认为当前")
    private String timeline;

    @Option(names = {"-n", "--limit"}, paramLabel = "N", description = "最多显示的 shove 数")
    private int limit;

    @Option(names = "--graph", description = "以图形显示全部历史")
    private boolean graph;

    @Override
    protected int execute() throws PocketException, IOException {
        Repository repo = openRepository();
        if (graph) {
            System.out.print(ShoveGraph.load(repo).render());
            return 0;
        }
        String name = timeline != null ? timeline : repo.getCurrentTimelineName();
        List<Shove> shoves = repo.log(timeline, limit);
        if (shoves.isEmpty()) {
            System.out.println("timeline '" + name + "' has no shoves yet");
            return 0;
        }
        System.out.println("Shove history for timeline '" + name + "':");
        DiffEngine diffEngine = new DiffEngine();
        for (Shove shove : shoves) {
            System.out.println();
            System.out.println("Shove " + shove.getId());
            if (shove.isMerge()) {
                StringBuilder sb = new StringBuilder("Merge:");
                shove.getParentIds().forEach(p -> sb.append(' ').append(p.shortId()));
                System.out.println(sb);
            }
            System.out.println("Author: " + shove.getAuthor().display());
            System.out.println("Date:   " + DATE_FORMAT.format(shove.getTimestamp()));
            System.out.println();
            for (String line : shove.getMessage().split("\n", -1)) {
                System.out.println("    " + line);
            }
            if (verbose) {
                printChanges(repo, diffEngine, shove);
            }
        }
        return 0;
    }

    private static void printChanges(Repository repo, DiffEngine diffEngine, Shove shove)
            throws PocketException, IOException {
        List<FileChange> changes = repo.getChanges(shove);
        if (changes.isEmpty()) {
            return;
        }
        System.out.println();
        for (FileChange c : changes) {
            switch (c.getChangeType()) {
                case ADDED:
                    System.out.println("  added:    " + c.getPath());
                    break;
                case DELETED:
                    System.out.println("  deleted:  " + c.getPath());
                    break;
                case RENAMED:
                    System.out.println("  renamed:  " + c.getOldPath() + " -> " + c.getPath());
                    break;
                default:
                    System.out.println("  modified: " + c.getPath());
                    break;
            }
        }
        for (FileChange c : changes) {
            if (c.getOldId() != null && c.getNewId() != null && c.getOldId().equals(c.getNewId())) {
                continue;
            }
            byte[] before = c.getOldId() == null ? null : repo.getObjects().get(c.getOldId());
            byte[] after = c.getNewId() == null ? null : repo.getObjects().get(c.getNewId());
            String oldPath = c.getOldId() == null ? null : (c.getOldPath() != null ? c.getOldPath() : c.getPath());
            String newPath = c.getNewId() == null ? null : c.getPath();
            System.out.println();
            System.out.print(DiffEngine.format(diffEngine.diff(oldPath, before, newPath, after, DiffOptions.defaults())));
        }
    }
}
