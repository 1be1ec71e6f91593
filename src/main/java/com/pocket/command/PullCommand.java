package com.pocket.command;

import com.pocket.exception.PocketException;
import com.pocket.merge.MergeResult;
import com.pocket.remote.RemoteManager;
import com.pocket.repo.Repository;
import com.pocket.repo.RepositoryLock;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;

/**
 * pocket pull - fish 之后把 remote/timeline 合并进当前 timeline。
 */
@Command(name = "pull", mixinStandardHelpOptions = true, description = "获取并合并远端 timeline")
public class PullCommand extends PocketCommand {

    @Parameters(index = "0", arity = "0..1", paramLabel = "REMOTE", description = "远端名称，默认为默认远端")
    private String remote;

    @Parameters(index = "1", arity = "0..1", paramLabel = "TIMELINE", description = "远端 timeline，默认与当前 timeline 同名")
    private String timeline;

    @Override
    protected int execute() throws PocketException, IOException {
        Repository repo = openRepository();
        try (RepositoryLock lock = repo.lock()) {
            MergeResult result = new RemoteManager(repo).pull(remote, timeline);
            return MergeCommand.report(result);
        }
    }
}
