package com.pocket.command;

import com.pocket.Pocket;
import com.pocket.exception.PocketException;
import com.pocket.repo.Repository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.IExitCodeGenerator;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 子命令基类：统一获取起始目录、打开仓库，并把 PocketException / IOException
 * 转成 stderr 上的 "fatal: ..." 与退出码 1。
 */
public abstract class PocketCommand implements Runnable, IExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PocketCommand.class);

    @Spec
    protected CommandSpec spec;

    private int exitCode = 0;

    @Override
    public final void run() {
        exitCode = 0;
        try {
            exitCode = execute();
        } catch (PocketException e) {
            log.info("{} failed: {}", spec.qualifiedName(), e.getMessage());
            log.debug("{} failure detail", spec.qualifiedName(), e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
        } catch (IOException e) {
            log.error("{} failed", spec.qualifiedName(), e);
            System.err.println("fatal: " + e.getMessage());
            exitCode = 1;
        }
    }

    /** 执行命令，返回退出码。 */
    protected abstract int execute() throws PocketException, IOException;

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /** 由根命令的 -C 决定的起始路径。 */
    protected Path startPath() {
        Object root = spec != null ? spec.root().userObject() : null;
        if (root instanceof Pocket) {
            return ((Pocket) root).getStartPath();
        }
        return Paths.get("").toAbsolutePath().normalize();
    }

    /** 从起始路径向上查找并打开仓库。 */
    protected Repository openRepository() throws PocketException, IOException {
        Repository repo = Repository.open(startPath());
        log.debug("repo root={}", repo.getRoot());
        return repo;
    }

    /** 命令行上的路径（相对起始目录）转换为相对仓库根的路径。 */
    protected String toRepoPath(Repository repo, String arg) throws PocketException {
        return repo.relativePath(startPath().resolve(arg).normalize());
    }
}
