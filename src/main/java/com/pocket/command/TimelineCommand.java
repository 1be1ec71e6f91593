package com.pocket.command;

import com.pocket.exception.PocketException;
import com.pocket.obj.ShoveId;
import com.pocket.repo.Repository;
import com.pocket.repo.RepositoryLock;
import com.pocket.repo.Timeline;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;

/**
 * pocket timeline - 管理 timeline（分支）：new / switch / list / delete。不带子命令时等同 list。
 */
@Command(name = "timeline", mixinStandardHelpOptions = true, description = "管理 timeline",
        subcommands = {
                TimelineCommand.New.class,
                TimelineCommand.Switch.class,
                TimelineCommand.ListTimelines.class,
                TimelineCommand.Delete.class
        })
public class TimelineCommand extends PocketCommand {

    @Override
    protected int execute() throws PocketException, IOException {
        return list(openRepository());
    }

    static int list(Repository repo) throws PocketException, IOException {
        String current = repo.getCurrentTimelineName();
        System.out.println("Timelines:");
        for (Timeline t : repo.listTimelines()) {
            String head = t.getHead() != null ? t.getHead().shortId() : "(no shoves)";
            String marker = t.getName().equals(current) ? "* " : "  ";
            String tracking = t.getRemoteTracking() != null
                    ? " [" + t.getRemoteTracking().getRemoteName() + "/" + t.getRemoteTracking().getRemoteTimeline() + "]"
                    : "";
            System.out.println(marker + t.getName() + " " + head + tracking);
        }
        return 0;
    }

    /** timeline new &lt;name&gt; [--based-on &lt;ref&gt;] */
    @Command(name = "new", mixinStandardHelpOptions = true, description = "创建 timeline")
    public static class New extends PocketCommand {

        @Parameters(index = "0", paramLabel = "NAME")
        private String name;

        @Option(names = {"-b", "--based-on"}, paramLabel = "REF", description = "起点 shove 或 timeline，默认为当前 head")
        private String basedOn;

        @Override
        protected int execute() throws PocketException, IOException {
            Repository repo = openRepository();
            try (RepositoryLock lock = repo.lock()) {
                ShoveId base = basedOn != null ? repo.resolveShove(basedOn) : null;
                Timeline timeline = repo.createTimeline(name, base);
                System.out.println("Created timeline '" + name + "' based on shove " + timeline.getHead().shortId());
            }
            return 0;
        }
    }

    /** timeline switch &lt;name&gt; [--force] */
    @Command(name = "switch", mixinStandardHelpOptions = true, description = "切换 timeline")
    public static class Switch extends PocketCommand {

        @Parameters(index = "0", paramLabel = "NAME")
        private String name;

        @Option(names = {"-f", "--force"}, description = "丢弃未提交的修改")
        private boolean force;

        @Override
        protected int execute() throws PocketException, IOException {
            Repository repo = openRepository();
            try (RepositoryLock lock = repo.lock()) {
                repo.switchTimeline(name, force);
                System.out.println("Switched to timeline '" + name + "'");
            }
            return 0;
        }
    }

    @Command(name = "list", mixinStandardHelpOptions = true, description = "列出 timeline")
    public static class ListTimelines extends PocketCommand {
        @Override
        protected int execute() throws PocketException, IOException {
            return list(openRepository());
        }
    }

    @Command(name = "delete", mixinStandardHelpOptions = true, description = "删除 timeline")
    public static class Delete extends PocketCommand {

        @Parameters(index = "0", paramLabel = "NAME")
        private String name;

        @Override
        protected int execute() throws PocketException, IOException {
            Repository repo = openRepository();
            try (RepositoryLock lock = repo.lock()) {
                repo.deleteTimeline(name);
                System.out.println("Deleted timeline '" + name + "'");
            }
            return 0;
        }
    }
}
