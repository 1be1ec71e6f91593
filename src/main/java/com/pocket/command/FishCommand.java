package com.pocket.command;

import com.pocket.exception.PocketException;
import com.pocket.obj.ShoveId;
import com.pocket.remote.FetchResult;
import com.pocket.remote.RemoteManager;
import com.pocket.repo.Refs;
import com.pocket.repo.Repository;
import com.pocket.repo.RepositoryLock;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.Map;

/**
 * pocket fish - 从远端获取 shove 与对象，更新远端跟踪 timeline（remote/name），不改动本地 timeline。
 */
@Command(name = "fish", mixinStandardHelpOptions = true, description = "从远端获取")
public class FishCommand extends PocketCommand {

    @Parameters(index = "0", arity = "0..1", paramLabel = "REMOTE", description = "远端名称，默认为默认远端")
    private String remote;

    @Override
    protected int execute() throws PocketException, IOException {
        Repository repo = openRepository();
        try (RepositoryLock lock = repo.lock()) {
            FetchResult result = new RemoteManager(repo).fetch(remote);
            for (Map.Entry<String, ShoveId> e : result.getUpdated().entrySet()) {
                System.out.println("  " + Refs.remoteTimelineName(result.getRemote(), e.getKey()) + " -> "
                        + e.getValue().shortId());
            }
            for (String pruned : result.getPruned()) {
                System.out.println("  [deleted] " + Refs.remoteTimelineName(result.getRemote(), pruned));
            }
            System.out.println("Fetched from remote '" + result.getRemote() + "'"
                    + (result.isUpToDate() ? " (up to date)" : ": " + result.getShovesFetched() + " shove(s), "
                    + result.getObjectsFetched() + " object(s)"));
        }
        return 0;
    }
}
