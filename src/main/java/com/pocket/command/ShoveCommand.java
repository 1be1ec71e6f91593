package com.pocket.command;

import com.pocket.exception.PocketException;
import com.pocket.exception.RepositoryException;
import com.pocket.obj.Shove;
import com.pocket.repo.Repository;
import com.pocket.repo.RepositoryLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * pocket shove - 把 pile 中的内容提交为新的 shove。
 * 信息来自 -m，或 --editor 打开 $EDITOR 编辑（# 开头的行被忽略）。
 */
@Command(name = "shove", mixinStandardHelpOptions = true, description = "提交 pile 中的变更")
public class ShoveCommand extends PocketCommand {

    private static final Logger log = LoggerFactory.getLogger(ShoveCommand.class);

    static final String EDIT_FILE = "SHOVE_EDITMSG";

    @Option(names = {"-m", "--message"}, description = "提交信息")
    private String message;

    @Option(names = {"-e", "--editor"}, description = "用 $EDITOR 编辑提交信息")
    private boolean editor;

    @Override
    protected int execute() throws PocketException, IOException {
        Repository repo = openRepository();
        try (RepositoryLock lock = repo.lock()) {
            String msg = message;
            if (msg == null && editor) {
                msg = editMessage(repo);
            }
            if (msg == null) {
                throw new RepositoryException("no shove message provided, use -m or --editor to specify one");
            }
            Shove shove = repo.createShove(msg.trim());
            log.info("shove created id={} tree={}", shove.getId(), shove.getRootTreeId());
            System.out.println("[" + repo.getCurrentTimelineName() + " " + shove.getId().shortId() + "] "
                    + shove.getSummary());
        }
        return 0;
    }

    private String editMessage(Repository repo) throws PocketException, IOException {
        Path file = repo.getPocketDir().resolve(EDIT_FILE);
        Files.write(file, ("\n# Enter the shove message. Lines starting with '#' are ignored.\n")
                .getBytes(StandardCharsets.UTF_8));
        String editorCmd = System.getenv("EDITOR");
        if (editorCmd == null || editorCmd.isBlank()) {
            editorCmd = "vi";
        }
        List<String> command = new ArrayList<>(List.of(editorCmd.trim().split("\\s+")));
        command.add(file.toString());
        log.debug("launching editor {}", command);
        try {
            Process process = new ProcessBuilder(command).inheritIO().start();
            int status = process.waitFor();
            if (status != 0) {
                throw new RepositoryException("editor exited with non-zero status " + status);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepositoryException("interrupted while waiting for the editor", e);
        }
        StringBuilder sb = new StringBuilder();
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            if (!line.startsWith("#")) {
                sb.append(line).append('\n');
            }
        }
        Files.deleteIfExists(file);
        return sb.toString();
    }
}
