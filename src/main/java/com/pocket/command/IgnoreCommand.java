package com.pocket.command;

import com.pocket.exception.PocketException;
import com.pocket.repo.Repository;
import com.pocket.repo.RepositoryLock;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.util.List;

/**
 * pocket ignore - 查看或编辑 .pocketignore。不带参数时列出规则。
 */
@Command(name = "ignore", mixinStandardHelpOptions = true, description = "管理忽略规则")
public class IgnoreCommand extends PocketCommand {

    @Option(names = {"-a", "--add"}, paramLabel = "PATTERN", description = "添加规则")
    private List<String> add;

    @Option(names = {"-r", "--remove"}, paramLabel = "PATTERN", description = "删除规则")
    private List<String> remove;

    @Option(names = {"-l", "--list"}, description = "列出规则")
    private boolean list;

    @Override
    protected int execute() throws PocketException, IOException {
        Repository repo = openRepository();
        boolean edited = (add != null && !add.isEmpty()) || (remove != null && !remove.isEmpty());
        if (edited) {
            try (RepositoryLock lock = repo.lock()) {
                if (add != null) {
                    for (String p : add) {
                        System.out.println(repo.ignoreAdd(p)
                                ? "Added ignore pattern '" + p + "'"
                                : "Ignore pattern '" + p + "' already present");
                    }
                }
                if (remove != null) {
                    for (String p : remove) {
                        System.out.println(repo.ignoreRemove(p)
                                ? "Removed ignore pattern '" + p + "'"
                                : "Ignore pattern '" + p + "' not found");
                    }
                }
            }
        }
        if (list || !edited) {
            System.out.println("Ignore patterns:");
            for (String p : repo.ignoreList()) {
                System.out.println("  " + p);
            }
        }
        return 0;
    }
}
