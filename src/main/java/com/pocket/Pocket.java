package com.pocket;

import com.pocket.command.DiffCommand;
import com.pocket.command.FishCommand;
import com.pocket.command.GraphCommand;
import com.pocket.command.IgnoreCommand;
import com.pocket.command.LogCommand;
import com.pocket.command.MergeCommand;
import com.pocket.command.NewRepoCommand;
import com.pocket.command.PileCommand;
import com.pocket.command.PocketExecutionExceptionHandler;
import com.pocket.command.PullCommand;
import com.pocket.command.PushCommand;
import com.pocket.command.RemoteCommand;
import com.pocket.command.ResolveCommand;
import com.pocket.command.ShoveCommand;
import com.pocket.command.StatusCommand;
import com.pocket.command.TimelineCommand;
import com.pocket.command.UnpileCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * pocket 命令行入口。
 * <p>
 * 所有 pocket 命令都经由此类执行。命令的起始目录由 -C 统一提供，子命令通过 {@link #getStartPath()} 获取。
 */
@Command(name = "pocket", mixinStandardHelpOptions = true, version = "pocket 1.0.0",
        description = "pocket - 内容寻址的版本控制")
public class Pocket implements Runnable {

    @Option(names = {"-C", "--directory"}, paramLabel = "PATH",
            description = "以指定路径作为工作目录执行命令（默认为当前目录）")
    private Path workingDirectory;

    /** 未指定子命令时打印用法。 */
    @Override
    public void run() {
        new CommandLine(this).usage(System.out);
    }

    /**
     * 命令的起始路径。new-repo 在此创建仓库，其余命令从此向上查找 .pocket。
     *
     * @return 已规范化的绝对路径
     */
    public Path getStartPath() {
        Path base = workingDirectory != null ? workingDirectory : Paths.get("");
        return base.toAbsolutePath().normalize();
    }

    /**
     * 创建注册了全部子命令的 CommandLine，供 main() 和测试使用。
     */
    public static CommandLine createCommandLine() {
        return new CommandLine(new Pocket())
                .addSubcommand("new-repo", new NewRepoCommand())
                .addSubcommand("status", new StatusCommand())
                .addSubcommand("pile", new PileCommand())
                .addSubcommand("unpile", new UnpileCommand())
                .addSubcommand("shove", new ShoveCommand())
                .addSubcommand("log", new LogCommand())
                .addSubcommand("timeline", new TimelineCommand())
                .addSubcommand("merge", new MergeCommand())
                .addSubcommand("resolve", new ResolveCommand())
                .addSubcommand("remote", new RemoteCommand())
                .addSubcommand("fish", new FishCommand())
                .addSubcommand("pull", new PullCommand())
                .addSubcommand("push", new PushCommand())
                .addSubcommand("ignore", new IgnoreCommand())
                .addSubcommand("graph", new GraphCommand())
                .addSubcommand("diff", new DiffCommand())
                .setExecutionExceptionHandler(new PocketExecutionExceptionHandler());
    }

    /**
     * 主入口。调试日志：-Dpocket.debug=true、环境变量 POCKET_DEBUG=true，或 -Dpocket.log.level=DEBUG。
     */
    public static void main(String[] args) {
        if ("true".equalsIgnoreCase(System.getProperty("pocket.debug"))
                || "true".equalsIgnoreCase(System.getenv("POCKET_DEBUG"))) {
            System.setProperty("pocket.log.level", "DEBUG");
        }
        CommandLine cli = createCommandLine();
        String[] runArgs = args != null && args.length > 0 ? args : new String[]{"--help"};
        int exitCode = cli.execute(runArgs);
        System.exit(exitCode);
    }
}
