package com.pocket.repo;

import com.pocket.exception.CorruptObjectException;
import com.pocket.exception.RepositoryException;
import com.pocket.exception.ShoveNotFoundException;
import com.pocket.exception.TimelineNotFoundException;
import com.pocket.obj.Shove;
import com.pocket.obj.ShoveId;
import com.pocket.utils.FileUtils;
import com.pocket.utils.TomlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * 引用与 shove 记录：HEAD、timelines/&lt;name&gt;.toml、timelines/remotes/&lt;remote&gt;/&lt;name&gt;.toml、
 * shoves/&lt;id&gt;.toml。
 */
public final class Refs {

    private static final Logger log = LoggerFactory.getLogger(Refs.class);

    private static final String HEAD = "HEAD";
    private static final String TIMELINES_DIR = "timelines";
    private static final String REMOTES_DIR = "remotes";
    private static final String SHOVES_DIR = "shoves";
    private static final String TOML_SUFFIX = ".toml";
    private static final Pattern HEAD_TIMELINE = Pattern.compile("timeline:\\s*(.+)");

    private final Path pocketDir;

    /**
     * 以 .pocket 目录为基准，HEAD 与 timelines 路径均相对于 pocketDir。
     */
    public Refs(Path pocketDir) {
        this.pocketDir = pocketDir;
    }

    // ---------- HEAD ----------

    /**
     * 解析 HEAD，返回当前 timeline 名称。
     */
    public String readHead() throws RepositoryException, IOException {
        Path headFile = pocketDir.resolve(HEAD);
        if (!Files.exists(headFile)) {
            throw new RepositoryException("HEAD is missing in " + pocketDir);
        }
        String content = Files.readString(headFile, StandardCharsets.UTF_8).trim();
        Matcher m = HEAD_TIMELINE.matcher(content);
        if (!m.matches()) {
            throw new RepositoryException("HEAD is corrupt: '" + content + "'");
        }
        String name = m.group(1).trim();
        log.debug("readHead timeline={}", name);
        return name;
    }

    /** 将 HEAD 指向给定 timeline。 */
    public void writeHead(String timelineName) throws IOException {
        FileUtils.writeAtomically(pocketDir.resolve(HEAD),
                ("timeline: " + timelineName + "\n").getBytes(StandardCharsets.UTF_8));
        log.debug("writeHead timeline={}", timelineName);
    }

    // ---------- 本地 timeline ----------

    public boolean timelineExists(String name) {
        return Timeline.isValidName(name) && Files.exists(timelinePath(name));
    }

    /** 读取本地 timeline；不存在时抛 TimelineNotFoundException。 */
    public Timeline loadTimeline(String name) throws TimelineNotFoundException, CorruptObjectException, IOException {
        if (!timelineExists(name)) {
            throw new TimelineNotFoundException("timeline '" + name + "' not found");
        }
        return readTimeline(timelinePath(name));
    }

    /** 写入本地 timeline。 */
    public void saveTimeline(Timeline timeline) throws IOException {
        if (!Timeline.isValidName(timeline.getName())) {
            throw new IllegalArgumentException("invalid timeline name: " + timeline.getName());
        }
        TomlUtils.write(timelinePath(timeline.getName()), timeline);
        log.debug("saved timeline {} head={}", timeline.getName(), timeline.getHead());
    }

    public void deleteTimeline(String name) throws IOException {
        Files.deleteIfExists(timelinePath(name));
        log.debug("deleted timeline {}", name);
    }

    /** 所有本地 timeline，按名称排序。 */
    public List<Timeline> listTimelines() throws CorruptObjectException, IOException {
        return readAll(pocketDir.resolve(TIMELINES_DIR));
    }

    // ---------- 远端跟踪 timeline ----------

    /** 远端跟踪 timeline 的显示名：&lt;remote&gt;/&lt;name&gt;。 */
    public static String remoteTimelineName(String remote, String name) {
        return remote + "/" + name;
    }

    public boolean remoteTimelineExists(String remote, String name) {
        return Timeline.isValidName(remote) && Timeline.isValidName(name)
                && Files.exists(remoteTimelinePath(remote, name));
    }

    /** 读取远端跟踪 timeline（name 为远端上的名称）。 */
    public Timeline loadRemoteTimeline(String remote, String name)
            throws TimelineNotFoundException, CorruptObjectException, IOException {
        if (!remoteTimelineExists(remote, name)) {
            throw new TimelineNotFoundException("timeline '" + remoteTimelineName(remote, name) + "' not found");
        }
        return readTimeline(remoteTimelinePath(remote, name));
    }

    /** 写入远端跟踪 timeline，timeline.name 为远端上的名称。 */
    public void saveRemoteTimeline(String remote, Timeline timeline) throws IOException {
        TomlUtils.write(remoteTimelinePath(remote, timeline.getName()), timeline);
        log.debug("saved remote timeline {} head={}", remoteTimelineName(remote, timeline.getName()), timeline.getHead());
    }

    /** 某个远端的全部跟踪 timeline，按名称排序。 */
    public List<Timeline> listRemoteTimelines(String remote) throws CorruptObjectException, IOException {
        return readAll(pocketDir.resolve(TIMELINES_DIR).resolve(REMOTES_DIR).resolve(remote));
    }

    /** 删除单个远端跟踪 timeline。 */
    public void deleteRemoteTimeline(String remote, String name) throws IOException {
        if (remoteTimelineExists(remote, name)) {
            Files.deleteIfExists(remoteTimelinePath(remote, name));
            log.debug("deleted remote timeline {}", remoteTimelineName(remote, name));
        }
    }

    /** 删除某个远端的全部跟踪 timeline。 */
    public void deleteRemoteTimelines(String remote) throws IOException {
        Path dir = pocketDir.resolve(TIMELINES_DIR).resolve(REMOTES_DIR).resolve(remote);
        if (!Files.isDirectory(dir)) {
            return;
        }
        try (Stream<Path> stream = Files.list(dir)) {
            for (Path p : (Iterable<Path>) stream::iterator) {
                Files.deleteIfExists(p);
            }
        }
        Files.deleteIfExists(dir);
    }

    /**
     * 按名称解析 timeline：先找本地，名称形如 remote/name 时再找远端跟踪 timeline。
     */
    public Timeline resolveTimeline(String name) throws TimelineNotFoundException, CorruptObjectException, IOException {
        if (timelineExists(name)) {
            return loadTimeline(name);
        }
        int slash = name != null ? name.indexOf('/') : -1;
        if (slash > 0) {
            String remote = name.substring(0, slash);
            String remoteName = name.substring(slash + 1);
            if (remoteTimelineExists(remote, remoteName)) {
                return loadRemoteTimeline(remote, remoteName);
            }
        }
        throw new TimelineNotFoundException("timeline '" + name + "' not found");
    }

    // ---------- shove ----------

    public boolean hasShove(ShoveId id) {
        return Files.exists(shovePath(id));
    }

    /** 读取 shove；不存在时抛 ShoveNotFoundException。 */
    public Shove loadShove(ShoveId id) throws ShoveNotFoundException, CorruptObjectException, IOException {
        Path p = shovePath(id);
        if (!Files.exists(p)) {
            throw new ShoveNotFoundException("shove " + id + " not found");
        }
        try {
            return TomlUtils.read(p, Shove.class);
        } catch (IOException e) {
            throw new CorruptObjectException("shove " + id + " cannot be parsed: " + e.getMessage(), e);
        }
    }

    /** 写入 shove；shove 不可变，已存在时不再覆盖。 */
    public void saveShove(Shove shove) throws IOException {
        Path p = shovePath(shove.getId());
        if (Files.exists(p)) {
            log.debug("shove exists id={}", shove.getId().shortId());
            return;
        }
        TomlUtils.write(p, shove);
        log.debug("saved shove id={}", shove.getId().shortId());
    }

    /** 所有已持久化 shove 的 id。 */
    public List<ShoveId> listShoveIds() throws IOException {
        List<ShoveId> ids = new ArrayList<>();
        Path dir = pocketDir.resolve(SHOVES_DIR);
        if (!Files.isDirectory(dir)) {
            return ids;
        }
        try (Stream<Path> stream = Files.list(dir)) {
            for (Path p : (Iterable<Path>) stream::iterator) {
                String fileName = p.getFileName().toString();
                if (fileName.endsWith(TOML_SUFFIX) && !fileName.startsWith(".")) {
                    ids.add(ShoveId.of(fileName.substring(0, fileName.length() - TOML_SUFFIX.length())));
                }
            }
        }
        ids.sort(Comparator.naturalOrder());
        return ids;
    }

    private Timeline readTimeline(Path p) throws CorruptObjectException, IOException {
        try {
            return TomlUtils.read(p, Timeline.class);
        } catch (IOException e) {
            throw new CorruptObjectException("timeline file " + p.getFileName() + " cannot be parsed: " + e.getMessage(), e);
        }
    }

    private List<Timeline> readAll(Path dir) throws CorruptObjectException, IOException {
        List<Timeline> timelines = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return timelines;
        }
        try (Stream<Path> stream = Files.list(dir)) {
            for (Path p : (Iterable<Path>) stream::iterator) {
                String fileName = p.getFileName().toString();
                if (Files.isRegularFile(p) && fileName.endsWith(TOML_SUFFIX) && !fileName.startsWith(".")) {
                    timelines.add(readTimeline(p));
                }
            }
        }
        timelines.sort(Comparator.comparing(Timeline::getName));
        return timelines;
    }

    private Path timelinePath(String name) {
        return pocketDir.resolve(TIMELINES_DIR).resolve(name + TOML_SUFFIX);
    }

    private Path remoteTimelinePath(String remote, String name) {
        return pocketDir.resolve(TIMELINES_DIR).resolve(REMOTES_DIR).resolve(remote).resolve(name + TOML_SUFFIX);
    }

    private Path shovePath(ShoveId id) {
        return pocketDir.resolve(SHOVES_DIR).resolve(id.getValue() + TOML_SUFFIX);
    }
}
