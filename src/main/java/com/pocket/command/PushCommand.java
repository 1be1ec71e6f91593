package com.pocket.command;

import com.pocket.exception.PocketException;
import com.pocket.remote.PushResult;
import com.pocket.remote.RemoteManager;
import com.pocket.repo.Repository;
import com.pocket.repo.RepositoryLock;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;

/**
 * pocket push - 把 timeline 推送到远端。非快进时拒绝，除非 --force。
 */
@Command(name = "push", mixinStandardHelpOptions = true, description = "推送 timeline 到远端")
public class PushCommand extends PocketCommand {

    @Parameters(index = "0", arity = "0..1", paramLabel = "REMOTE", description = "远端名称，默认为默认远端")
    private String remote;

    @Parameters(index = "1", arity = "0..1", paramLabel = "TIMELINE", description = "要推送的 timeline，默认为当前")
    private String timeline;

    @Option(names = {"-f", "--force"}, description = "允许非快进推送")
    private boolean force;

    @Override
    protected int execute() throws PocketException, IOException {
        Repository repo = openRepository();
        try (RepositoryLock lock = repo.lock()) {
            PushResult result = new RemoteManager(repo).push(remote, timeline, force);
            if (result.isUpToDate()) {
                System.out.println("Everything up to date");
                return 0;
            }
            String from = result.getOldHead() == null ? "(new)" : result.getOldHead().shortId();
            System.out.println("  " + result.getTimeline() + ": " + from + (result.isForced() ? " ... " : " .. ")
                    + result.getNewHead().shortId() + (result.isForced() ? " (forced update)" : ""));
            System.out.println("Pushed timeline '" + result.getTimeline() + "' to remote '" + result.getRemote() + "'");
        }
        return 0;
    }
}
