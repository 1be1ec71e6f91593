package com.pocket.command;

import com.pocket.exception.PocketException;
import com.pocket.remote.Remote;
import com.pocket.remote.RemoteManager;
import com.pocket.repo.Repository;
import com.pocket.repo.RepositoryLock;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.util.List;

/**
 * pocket remote - 管理远端：add / remove / list。不带子命令时等同 list。
 */
@Command(name = "remote", mixinStandardHelpOptions = true, description = "管理远端",
        subcommands = {RemoteCommand.Add.class, RemoteCommand.Remove.class, RemoteCommand.ListRemotes.class})
public class RemoteCommand extends PocketCommand {

    @Override
    protected int execute() throws PocketException, IOException {
        return list(openRepository());
    }

    static int list(Repository repo) {
        List<Remote> remotes = new RemoteManager(repo).listRemotes();
        String defaultRemote = repo.getConfig().getRemote().getDefaultRemote();
        System.out.println("Remotes:");
        for (Remote r : remotes) {
            String marker = r.getName().equals(defaultRemote) ? " (default)" : "";
            System.out.println("  " + r.getName() + ": " + r.getUrl() + marker);
        }
        return 0;
    }

    @Command(name = "add", mixinStandardHelpOptions = true, description = "添加远端")
    public static class Add extends PocketCommand {

        @Parameters(index = "0", paramLabel = "NAME")
        private String name;

        @Parameters(index = "1", paramLabel = "URL")
        private String url;

        @Override
        protected int execute() throws PocketException, IOException {
            Repository repo = openRepository();
            try (RepositoryLock lock = repo.lock()) {
                new RemoteManager(repo).addRemote(name, url);
                System.out.println("Added remote '" + name + "' with URL '" + url + "'");
            }
            return 0;
        }
    }

    @Command(name = "remove", mixinStandardHelpOptions = true, description = "删除远端")
    public static class Remove extends PocketCommand {

        @Parameters(index = "0", paramLabel = "NAME")
        private String name;

        @Override
        protected int execute() throws PocketException, IOException {
            Repository repo = openRepository();
            try (RepositoryLock lock = repo.lock()) {
                new RemoteManager(repo).removeRemote(name);
                System.out.println("Removed remote '" + name + "'");
            }
            return 0;
        }
    }

    @Command(name = "list", mixinStandardHelpOptions = true, description = "列出远端")
    public static class ListRemotes extends PocketCommand {
        @Override
        protected int execute() throws PocketException, IOException {
            return list(openRepository());
        }
    }
}
