package com.pocket.command;

import com.pocket.config.Config;
import com.pocket.exception.PocketException;
import com.pocket.exception.RepositoryException;
import com.pocket.repo.Repository;
import com.pocket.utils.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * pocket new-repo - 在指定目录（默认当前目录）创建仓库。
 * 默认同时写入 README.md 与 .pocketignore；--template minimal 不写 README，--no-default 两者都不写。
 */
@Command(name = "new-repo", mixinStandardHelpOptions = true, description = "创建新仓库")
public class NewRepoCommand extends PocketCommand {

    private static final Logger log = LoggerFactory.getLogger(NewRepoCommand.class);

    static final String TEMPLATE_DEFAULT = "default";
    static final String TEMPLATE_MINIMAL = "minimal";
    static final String README = "# New Pocket Repository\n\nCreated with Pocket VCS.\n";

    @Parameters(index = "0", arity = "0..1", description = "仓库目录，默认为当前目录")
    private Path path;

    @Option(names = "--template", paramLabel = "NAME", description = "模板：default 或 minimal")
    private String template;

    @Option(names = "--no-default", description = "不创建默认文件")
    private boolean noDefault;

    @Override
    protected int execute() throws PocketException, IOException {
        String tpl = template == null ? TEMPLATE_DEFAULT : template;
        if (!tpl.equals(TEMPLATE_DEFAULT) && !tpl.equals(TEMPLATE_MINIMAL)) {
            throw new RepositoryException("unknown template '" + tpl + "' (expected default or minimal)");
        }
        Path target = path == null ? startPath() : startPath().resolve(path).normalize();
        FileUtils.createDirectories(target);
        System.out.println("Creating new Pocket repository at " + target);
        Config config = Config.defaults();
        Repository repo = Repository.create(target, config);
        if (!noDefault) {
            if (tpl.equals(TEMPLATE_DEFAULT)) {
                writeIfMissing(target.resolve("README.md"), README);
            }
            StringBuilder ignore = new StringBuilder("# Pocket ignore file\n");
            for (String p : config.getCore().getIgnorePatterns()) {
                ignore.append(p).append('\n');
            }
            writeIfMissing(target.resolve(Repository.IGNORE_FILE), ignore.toString());
        }
        log.info("new-repo created at {} template={} noDefault={}", target, tpl, noDefault);
        System.out.println("Repository created successfully.");
        System.out.println("Current timeline: " + repo.getCurrentTimelineName());
        return 0;
    }

    private static void writeIfMissing(Path file, String content) throws IOException {
        if (!Files.exists(file)) {
            Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        }
    }
}
