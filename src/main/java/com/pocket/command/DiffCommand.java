package com.pocket.command;

import com.pocket.diff.DiffEngine;
import com.pocket.diff.DiffOptions;
import com.pocket.diff.DiffResult;
import com.pocket.exception.PocketException;
import com.pocket.repo.PileEntry;
import com.pocket.repo.Repository;
import com.pocket.repo.Snapshot;
import com.pocket.repo.Workspace;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.Arrays;
import java.util.Set;
import java.util.TreeSet;

/**
 * pocket diff - 工作区相对 HEAD 的 unified diff，可限定到某个文件或目录。
 */
@Command(name = "diff", mixinStandardHelpOptions = true, description = "显示工作区相对 HEAD 的差异")
public class DiffCommand extends PocketCommand {

    @Parameters(index = "0", arity = "0..1", paramLabel = "PATH", description = "只比较该文件或目录")
    private String path;

    @Option(names = {"-w", "--ignore-whitespace"}, description = "忽略空白差异")
    private boolean ignoreWhitespace;

    @Option(names = {"-i", "--ignore-case"}, description = "忽略大小写")
    private boolean ignoreCase;

    @Option(names = {"-U", "--unified"}, paramLabel = "N", description = "上下文行数（默认 3）")
    private int contextLines = DiffOptions.DEFAULT_CONTEXT_LINES;

    @Override
    protected int execute() throws PocketException, IOException {
        Repository repo = openRepository();
        String prefix = path == null ? "" : toRepoPath(repo, path);
        DiffOptions options = DiffOptions.builder()
                .ignoreWhitespace(ignoreWhitespace)
                .ignoreCase(ignoreCase)
                .contextLines(contextLines)
                .build();
        Snapshot head = repo.headSnapshot();
        Workspace workspace = repo.getWorkspace();
        Set<String> paths = new TreeSet<>(head.getFiles().keySet());
        for (PileEntry e : repo.getPile().getEntries()) {
            paths.add(e.getPath());
        }
        DiffEngine engine = new DiffEngine();
        for (String p : paths) {
            if (!matches(p, prefix)) {
                continue;
            }
            byte[] before = head.contains(p) ? repo.getObjects().get(head.idOf(p)) : null;
            byte[] after = workspace.exists(p) && !workspace.isDirectory(p) ? workspace.readFile(p) : null;
            if ((before == null && after == null) || (before != null && after != null && Arrays.equals(before, after))) {
                continue;
            }
            DiffResult result = engine.diff(before == null ? null : p, before, after == null ? null : p, after, options);
            if (result.isIdentical()) {
                continue;
            }
            System.out.print(DiffEngine.format(result));
        }
        return 0;
    }

    private static boolean matches(String p, String prefix) {
        return prefix.isEmpty() || p.equals(prefix) || p.startsWith(prefix + "/");
    }
}
