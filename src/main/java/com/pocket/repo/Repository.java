package com.pocket.repo;

import com.pocket.config.Config;
import com.pocket.exception.ConfigException;
import com.pocket.exception.EmptyPileException;
import com.pocket.exception.NotARepositoryException;
import com.pocket.exception.PileException;
import com.pocket.exception.PocketException;
import com.pocket.exception.RepositoryException;
import com.pocket.exception.RepositoryExistsException;
import com.pocket.exception.RepositoryLockedException;
import com.pocket.exception.ShoveNotFoundException;
import com.pocket.exception.StalePileException;
import com.pocket.exception.TimelineExistsException;
import com.pocket.exception.TimelineNotFoundException;
import com.pocket.exception.UncommittedChangesException;
import com.pocket.exception.UnresolvedConflictsException;
import com.pocket.merge.ConflictResolution;
import com.pocket.merge.MergeState;
import com.pocket.obj.Author;
import com.pocket.obj.FileChange;
import com.pocket.obj.ObjectId;
import com.pocket.obj.Shove;
import com.pocket.obj.ShoveId;
import com.pocket.obj.TreeEntry;
import com.pocket.utils.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;

/**
 * 仓库：定位 .pocket 目录，提供 ObjectStore、Refs、Workspace、Pile，
 * 并实现 status / pile / shove / timeline 等仓库级操作。
 * 每次查询 HEAD 都重新从磁盘读取。
 */
public final class Repository {

    private static final Logger log = LoggerFactory.getLogger(Repository.class);

    public static final String POCKET_DIR = IgnoreRules.POCKET_DIR;
    public static final String IGNORE_FILE = ".pocketignore";
    private static final String CONFIG_FILE = "config.toml";
    private static final String PILES_DIR = "piles";
    private static final String PILE_FILE = "current.toml";
    private static final String[] LAYOUT_DIRS = {"objects", "shoves", "timelines", PILES_DIR};

    private final Path root;      // 工作区根
    private final Path pocketDir; // .pocket 目录
    private final ObjectStore objects;
    private final Refs refs;
    private final Workspace workspace;
    private final Config config;
    private final Pile pile;

    private Repository(Path root, Config config, Pile pile) {
        this.root = root.toAbsolutePath().normalize();
        this.pocketDir = this.root.resolve(POCKET_DIR);
        this.objects = new ObjectStore(pocketDir);
        this.refs = new Refs(pocketDir);
        this.workspace = new Workspace(this.root);
        this.config = config;
        this.pile = pile;
    }

    // ---------- 创建 / 打开 ----------

    /** 以默认配置在 path 下创建仓库。 */
    public static Repository create(Path path) throws PocketException, IOException {
        return create(path, Config.defaults());
    }

    /**
     * 在 path 下创建 .pocket/{objects,shoves,timelines,piles}、config.toml、默认 timeline 与 HEAD。
     * .pocket 已存在时抛 RepositoryExistsException。
     */
    public static Repository create(Path path, Config config) throws PocketException, IOException {
        Path root = path.toAbsolutePath().normalize();
        Path pocketDir = root.resolve(POCKET_DIR);
        if (Files.exists(pocketDir)) {
            throw new RepositoryExistsException("repository already exists at " + root);
        }
        String defaultTimeline = config.getCore().getDefaultTimeline();
        if (!Timeline.isValidName(defaultTimeline)) {
            throw new ConfigException("invalid default timeline name '" + defaultTimeline + "'");
        }
        for (String dir : LAYOUT_DIRS) {
            Files.createDirectories(pocketDir.resolve(dir));
        }
        config.save(pocketDir.resolve(CONFIG_FILE));
        Repository repo = new Repository(root, config, new Pile());
        repo.refs.saveTimeline(new Timeline(defaultTimeline, null));
        repo.refs.writeHead(defaultTimeline);
        repo.savePile();
        log.info("initialized empty repository at {}", root);
        return repo;
    }

    /**
     * 从 start 向上查找包含 .pocket 的目录作为仓库根；未找到返回 null。
     */
    public static Path findRoot(Path start) {
        Path current = start.toAbsolutePath().normalize();
        log.debug("find repo start={}", current);
        while (current != null) {
            if (Files.isDirectory(current.resolve(POCKET_DIR))) {
                log.debug("found repo at {}", current);
                return current;
            }
            current = current.getParent();
        }
        log.debug("no repo found");
        return null;
    }

    /**
     * 打开 start 所在的仓库：加载配置、HEAD、当前 timeline 与 pile。
     * pile 基于旧 head 且内容已全部与 HEAD 一致时视为上次 shove 后未清理，自动清空。
     */
    public static Repository open(Path start) throws PocketException, IOException {
        Path root = findRoot(start);
        if (root == null) {
            throw new NotARepositoryException("not a pocket repository (or any of the parent directories): "
                    + start.toAbsolutePath().normalize());
        }
        Path pocketDir = root.resolve(POCKET_DIR);
        Config config = Config.load(pocketDir.resolve(CONFIG_FILE));
        Pile pile;
        try {
            pile = Pile.load(pocketDir.resolve(PILES_DIR).resolve(PILE_FILE));
        } catch (IOException e) {
            throw new RepositoryException("pile is corrupt: " + e.getMessage(), e);
        }
        Repository repo = new Repository(root, config, pile);
        String current = repo.refs.readHead();
        if (!repo.refs.timelineExists(current)) {
            throw new RepositoryException("HEAD points to missing timeline '" + current + "'");
        }
        repo.recoverPile();
        return repo;
    }

    private void recoverPile() throws PocketException, IOException {
        ShoveId head = getHead();
        if (!pile.isStale(head)) {
            return;
        }
        Snapshot snapshot = snapshot(head);
        boolean redundant = true;
        for (PileEntry e : pile.getEntries()) {
            boolean applied;
            switch (e.getStatus()) {
                case DELETED:
                    applied = !snapshot.contains(e.getPath());
                    break;
                case RENAMED:
                    applied = !snapshot.contains(e.getOriginalPath()) && e.getObjectId().equals(snapshot.idOf(e.getPath()));
                    break;
                default:
                    applied = e.getObjectId().equals(snapshot.idOf(e.getPath()));
                    break;
            }
            if (!applied) {
                redundant = false;
                break;
            }
        }
        if (redundant) {
            log.warn("clearing pile left over from shove {} (already part of HEAD)", pile.getBaseShove());
            pile.clear();
            savePile();
        } else {
            log.warn("pile was built on {} but HEAD is {}", pile.getBaseShove(), head);
        }
    }

    /** 获取仓库写锁，修改仓库的命令在 try-with-resources 中持有。 */
    public RepositoryLock lock() throws RepositoryLockedException, IOException {
        return RepositoryLock.acquire(pocketDir);
    }

    // ---------- HEAD ----------

    /** 当前 timeline 名称（每次从 HEAD 读取）。 */
    public String getCurrentTimelineName() throws PocketException, IOException {
        return refs.readHead();
    }

    public Timeline getCurrentTimeline() throws PocketException, IOException {
        return refs.loadTimeline(refs.readHead());
    }

    /** 当前 timeline 的 head，空 timeline 返回 null。 */
    public ShoveId getHead() throws PocketException, IOException {
        return getCurrentTimeline().getHead();
    }

    /** 某个 shove 的扁平文件视图；id 为 null 时返回空视图。 */
    public Snapshot snapshot(ShoveId id) throws PocketException, IOException {
        if (id == null) {
            return Snapshot.empty();
        }
        Shove shove = refs.loadShove(id);
        return new Snapshot(id, TreeWalker.flatten(objects, shove.getRootTreeId()));
    }

    public Snapshot headSnapshot() throws PocketException, IOException {
        return snapshot(getHead());
    }

    /**
     * 解析用户给出的 shove 引用：完整 id、timeline 名称（含 remote/name）或唯一的 id 前缀（至少 4 位）。
     */
    public ShoveId resolveShove(String ref) throws PocketException, IOException {
        if (ref == null || ref.isBlank()) {
            throw new ShoveNotFoundException("empty shove reference");
        }
        String r = ref.trim();
        if (ShoveId.isValid(r) && refs.hasShove(ShoveId.of(r))) {
            return ShoveId.of(r);
        }
        try {
            Timeline t = refs.resolveTimeline(r);
            if (t.getHead() == null) {
                throw new ShoveNotFoundException("timeline '" + r + "' has no shoves");
            }
            return t.getHead();
        } catch (TimelineNotFoundException e) {
            log.debug("'{}' is not a timeline, trying shove id prefix", r);
        }
        if (r.length() >= 4) {
            List<ShoveId> matches = new ArrayList<>();
            for (ShoveId id : refs.listShoveIds()) {
                if (id.getValue().startsWith(r)) {
                    matches.add(id);
                }
            }
            if (matches.size() == 1) {
                return matches.get(0);
            }
            if (matches.size() > 1) {
                throw new ShoveNotFoundException("shove id prefix '" + r + "' is ambiguous");
            }
        }
        throw new ShoveNotFoundException("shove '" + r + "' not found");
    }

    // ---------- 忽略规则 ----------

    /** .pocketignore 存在时使用它，否则使用 core.ignore_patterns。 */
    public IgnoreRules ignoreRules() throws IOException {
        Path ignoreFile = root.resolve(IGNORE_FILE);
        if (Files.exists(ignoreFile)) {
            return new IgnoreRules(IgnoreRules.parse(Files.readString(ignoreFile, StandardCharsets.UTF_8)));
        }
        return new IgnoreRules(config.getCore().getIgnorePatterns());
    }

    public List<String> ignoreList() throws IOException {
        return ignoreRules().getPatterns();
    }

    /** 追加规则；已存在返回 false。 */
    public boolean ignoreAdd(String pattern) throws IOException {
        String p = pattern.trim();
        List<String> patterns = new ArrayList<>(ensureIgnoreFile());
        if (p.isEmpty() || patterns.contains(p)) {
            return false;
        }
        patterns.add(p);
        writeIgnoreFile(patterns);
        log.info("added ignore pattern '{}'", p);
        return true;
    }

    /** 删除规则；不存在返回 false。 */
    public boolean ignoreRemove(String pattern) throws IOException {
        String p = pattern.trim();
        List<String> patterns = new ArrayList<>(ensureIgnoreFile());
        if (!patterns.remove(p)) {
            return false;
        }
        writeIgnoreFile(patterns);
        log.info("removed ignore pattern '{}'", p);
        return true;
    }

    /** 首次编辑时用配置中的默认规则创建 .pocketignore。 */
    private List<String> ensureIgnoreFile() throws IOException {
        Path ignoreFile = root.resolve(IGNORE_FILE);
        if (!Files.exists(ignoreFile)) {
            writeIgnoreFile(config.getCore().getIgnorePatterns());
        }
        return IgnoreRules.parse(Files.readString(ignoreFile, StandardCharsets.UTF_8));
    }

    private void writeIgnoreFile(List<String> patterns) throws IOException {
        StringBuilder sb = new StringBuilder();
        for (String p : patterns) {
            sb.append(p).append('\n');
        }
        FileUtils.writeAtomically(root.resolve(IGNORE_FILE), sb.toString().getBytes(StandardCharsets.UTF_8));
    }

    // ---------- status ----------

    /**
     * 比较 HEAD tree、pile 与工作区：在 pile 中为已暂存；在 HEAD 中且内容相同为干净；
     * 内容不同为已修改；HEAD 中没有为未跟踪；HEAD 中有但磁盘上没有为已删除。
     */
    public RepoStatus status() throws PocketException, IOException {
        Timeline timeline = getCurrentTimeline();
        ShoveId head = timeline.getHead();
        Snapshot snapshot = snapshot(head);
        Pile current = Pile.load(pileFile());
        IgnoreRules ignore = ignoreRules();

        List<String> modified = new ArrayList<>();
        List<String> untracked = new ArrayList<>();
        List<String> deleted = new ArrayList<>();
        List<String> files = workspace.listFiles(ignore);
        Set<String> onDisk = new HashSet<>(files);
        for (String path : files) {
            if (current.contains(path)) {
                continue;
            }
            TreeEntry headEntry = snapshot.getFiles().get(path);
            if (headEntry == null) {
                untracked.add(path);
            } else if (isModified(path, headEntry)) {
                modified.add(path);
            }
        }
        for (String path : snapshot.getFiles().keySet()) {
            if (!onDisk.contains(path) && !current.contains(path) && !current.isRenamedFrom(path)
                    && !ignore.isIgnoredFile(path)) {
                deleted.add(path);
            }
        }
        List<String> conflicts = MergeState.load(pocketDir)
                .map(MergeState::getUnresolvedPaths)
                .orElse(List.of());
        log.debug("status timeline={} head={} piled={} modified={} untracked={} deleted={}",
                timeline.getName(), head, current.size(), modified.size(), untracked.size(), deleted.size());
        return RepoStatus.builder()
                .currentTimeline(timeline.getName())
                .headShove(head)
                .piledEntries(current.getEntries())
                .modifiedFiles(modified)
                .untrackedFiles(untracked)
                .deletedFiles(deleted)
                .conflicts(conflicts)
                .stalePile(current.isStale(head))
                .build();
    }

    private boolean isModified(String path, TreeEntry headEntry) throws IOException {
        ObjectId id = ObjectStore.hash(workspace.readFile(path));
        return !id.equals(headEntry.getId()) || workspace.getPermissions(path) != headEntry.getPermissions();
    }

    // ---------- pile ----------

    /**
     * 暂存给定路径（相对仓库根）。目录会递归暂存其中所有未被忽略的文件；
     * 磁盘上已不存在的已跟踪文件暂存为删除。被忽略的路径拒绝暂存。
     */
    public List<PileEntry> pile(Collection<String> paths) throws PocketException, IOException {
        Snapshot head = headSnapshot();
        IgnoreRules ignore = ignoreRules();
        Optional<MergeState> merge = MergeState.load(pocketDir);
        MergeState mergeState = merge.orElse(null);
        List<PileEntry> staged = new ArrayList<>();
        for (String raw : paths) {
            String rel = normalizePath(raw);
            if (!rel.isEmpty() && (ignore.isIgnoredFile(rel) || ignore.isIgnored(rel, workspace.isDirectory(rel)))) {
                throw new PileException("'" + rel + "' is ignored (see " + IGNORE_FILE + ")");
            }
            List<String> targets = new ArrayList<>();
            if (workspace.isDirectory(rel)) {
                targets.addAll(workspace.listFiles(rel, ignore));
                String prefix = rel.isEmpty() ? "" : rel + "/";
                for (String tracked : head.getFiles().keySet()) {
                    if (tracked.startsWith(prefix) && !workspace.exists(tracked) && !ignore.isIgnoredFile(tracked)) {
                        targets.add(tracked);
                    }
                }
            } else if (workspace.exists(rel) || head.contains(rel) || pile.contains(rel)) {
                targets.add(rel);
            } else {
                throw new PileException("pathspec '" + raw + "' did not match any files");
            }
            for (String path : targets) {
                PileEntry entry = pileOne(path, head);
                if (entry != null) {
                    staged.add(entry);
                }
                if (mergeState != null && mergeState.find(path).isPresent()) {
                    ObjectId resolvedId = entry != null ? entry.getObjectId() : head.idOf(path);
                    if (!workspace.exists(path)) {
                        resolvedId = null;
                    }
                    mergeState = mergeState.resolve(path, ConflictResolution.useMerged(resolvedId));
                    log.info("marked conflict in {} as resolved", path);
                }
            }
        }
        for (PileEntry renamed : pile.pairRenames(head)) {
            staged.removeIf(e -> e.getPath().equals(renamed.getPath()) || e.getPath().equals(renamed.getOriginalPath()));
            staged.add(renamed);
            log.info("detected rename {} -> {}", renamed.getOriginalPath(), renamed.getPath());
        }
        savePile();
        if (mergeState != null) {
            mergeState.save(pocketDir);
        }
        return staged;
    }

    private PileEntry pileOne(String path, Snapshot head) throws PocketException, IOException {
        if (workspace.exists(path)) {
            return pile.addPath(path, workspace.readFile(path), workspace.getPermissions(path), objects, head)
                    .orElse(null);
        }
        if (head.contains(path)) {
            return pile.markDeleted(path, head);
        }
        // 暂存后又被删除的新文件
        pile.removePath(path);
        return null;
    }

    /** 暂存所有已修改、未跟踪和已删除的文件。 */
    public List<PileEntry> pileAll() throws PocketException, IOException {
        RepoStatus status = status();
        List<String> paths = new ArrayList<>();
        paths.addAll(status.getModifiedFiles());
        paths.addAll(status.getUntrackedFiles());
        paths.addAll(status.getDeletedFiles());
        if (paths.isEmpty()) {
            return List.of();
        }
        return pile(paths);
    }

    /**
     * 暂存匹配 glob 的文件（含已删除的已跟踪文件）。不含 / 的 glob 也匹配文件名。
     */
    public List<PileEntry> pilePattern(String glob) throws PocketException, IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
        boolean nameOnly = !glob.contains("/");
        RepoStatus status = status();
        List<String> candidates = new ArrayList<>();
        candidates.addAll(status.getModifiedFiles());
        candidates.addAll(status.getUntrackedFiles());
        candidates.addAll(status.getDeletedFiles());
        List<String> matched = new ArrayList<>();
        for (String path : candidates) {
            Path p = Paths.get(path);
            if (matcher.matches(p) || (nameOnly && matcher.matches(p.getFileName()))) {
                matched.add(path);
            }
        }
        if (matched.isEmpty()) {
            throw new PileException("pattern '" + glob + "' did not match any changed files");
        }
        return pile(matched);
    }

    /** 取消暂存；目录会取消其下的所有记录。 */
    public List<PileEntry> unpile(Collection<String> paths) throws PocketException, IOException {
        List<PileEntry> removed = new ArrayList<>();
        for (String raw : paths) {
            String rel = normalizePath(raw);
            if (pile.contains(rel)) {
                removed.add(pile.removePath(rel));
                continue;
            }
            String prefix = rel.isEmpty() ? "" : rel + "/";
            List<String> under = new ArrayList<>();
            for (PileEntry e : pile.getEntries()) {
                if (e.getPath().startsWith(prefix)) {
                    under.add(e.getPath());
                }
            }
            if (under.isEmpty()) {
                throw new PileException("'" + rel + "' is not in the pile");
            }
            for (String path : under) {
                removed.add(pile.removePath(path));
            }
        }
        savePile();
        return removed;
    }

    /** 清空 pile，返回被移除的记录数。 */
    public int unpileAll() throws IOException {
        int count = pile.size();
        pile.clear();
        savePile();
        return count;
    }

    public Pile getPile() {
        return pile;
    }

    /** 持久化当前 pile。 */
    public void savePile() throws IOException {
        pile.save(pileFile());
    }

    private Path pileFile() {
        return pocketDir.resolve(PILES_DIR).resolve(PILE_FILE);
    }

    // ---------- shove ----------

    /**
     * 用 pile 生成新 shove：tree 为 HEAD tree 应用 pile 后的结果，父为当前 head；
     * 正在完成冲突合并时再加上被合并的 head。随后推进 timeline，最后清空 pile。
     */
    public Shove createShove(String message) throws PocketException, IOException {
        if (message == null || message.isBlank()) {
            throw new RepositoryException("aborting shove due to empty message");
        }
        Timeline timeline = getCurrentTimeline();
        ShoveId head = timeline.getHead();
        MergeState merge = MergeState.load(pocketDir).orElse(null);
        if (merge != null) {
            List<String> unresolved = merge.getUnresolvedPaths();
            if (!unresolved.isEmpty()) {
                throw new UnresolvedConflictsException("cannot shove: unresolved conflicts in " + String.join(", ", unresolved));
            }
            if (merge.getOursHead() != null && !merge.getOursHead().equals(head)) {
                throw new RepositoryException("merge was started on " + merge.getOursHead()
                        + " but timeline '" + timeline.getName() + "' is at " + head);
            }
        } else if (pile.isEmpty()) {
            throw new EmptyPileException("nothing piled to shove (use \"pocket pile\")");
        }
        if (pile.isStale(head)) {
            throw new StalePileException("pile was built on " + pile.getBaseShove() + " but timeline '"
                    + timeline.getName() + "' is at " + head + "; unpile and pile your changes again");
        }

        Snapshot snapshot = snapshot(head);
        SortedMap<String, TreeEntry> files = pile.applyTo(snapshot.getFiles());
        ObjectId treeId = TreeWalker.build(objects, files);
        List<ShoveId> parents = new ArrayList<>();
        if (head != null) {
            parents.add(head);
        }
        if (merge != null && merge.getTheirsHead() != null && !parents.contains(merge.getTheirsHead())) {
            parents.add(merge.getTheirsHead());
        }
        Instant now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        Shove shove = Shove.create(parents, currentAuthor(now), now, message, treeId);
        writeShove(timeline, shove);

        pile.clear();
        savePile();
        if (merge != null) {
            MergeState.clear(pocketDir);
        }
        return shove;
    }

    /** 持久化 shove 并推进 timeline。 */
    public void writeShove(Timeline timeline, Shove shove) throws IOException {
        refs.saveShove(shove);
        timeline.updateHead(shove.getId());
        refs.saveTimeline(timeline);
        log.info("created shove {} on {} tree={}", shove.getId().shortId(), timeline.getName(),
                shove.getRootTreeId().shortHex());
    }

    /** 以配置中的用户作为作者。 */
    public Author currentAuthor(Instant timestamp) {
        return Author.builder()
                .name(config.getUser().getName())
                .email(config.getUser().getEmail())
                .timestamp(timestamp)
                .build();
    }

    /** 与第一个父 shove 相比的文件变化；根 shove 的所有文件都是 ADDED。 */
    public List<FileChange> getChanges(Shove shove) throws PocketException, IOException {
        SortedMap<String, TreeEntry> mine = TreeWalker.flatten(objects, shove.getRootTreeId());
        if (shove.isRoot()) {
            return TreeWalker.diff(Snapshot.empty().getFiles(), mine);
        }
        return TreeWalker.diff(snapshot(shove.getFirstParent()).getFiles(), mine);
    }

    /** 与每个父 shove 分别比较的文件变化。 */
    public Map<ShoveId, List<FileChange>> getChangesByParent(Shove shove) throws PocketException, IOException {
        Map<ShoveId, List<FileChange>> result = new LinkedHashMap<>();
        SortedMap<String, TreeEntry> mine = TreeWalker.flatten(objects, shove.getRootTreeId());
        for (ShoveId parent : shove.getParentIds()) {
            result.put(parent, TreeWalker.diff(snapshot(parent).getFiles(), mine));
        }
        return result;
    }

    // ---------- timeline ----------

    /** 基于给定 shove（默认当前 head）创建 timeline。 */
    public Timeline createTimeline(String name, ShoveId basedOn) throws PocketException, IOException {
        if (!Timeline.isValidName(name)) {
            throw new RepositoryException("invalid timeline name '" + name + "'");
        }
        if (refs.timelineExists(name)) {
            throw new TimelineExistsException("timeline '" + name + "' already exists");
        }
        ShoveId base = basedOn != null ? basedOn : getHead();
        if (base == null) {
            throw new RepositoryException("cannot create timeline '" + name + "': current timeline has no shoves yet");
        }
        if (!refs.hasShove(base)) {
            throw new ShoveNotFoundException("shove " + base + " not found");
        }
        Timeline timeline = new Timeline(name, base);
        refs.saveTimeline(timeline);
        log.info("created timeline {} at {}", name, base.shortId());
        return timeline;
    }

    /**
     * 切换到另一个 timeline 并检出其 tree。pile 非空、有修改或有未完成合并时拒绝，除非 force；
     * force 时丢弃 pile 与合并状态。
     */
    public Timeline switchTimeline(String name, boolean force) throws PocketException, IOException {
        String currentName = refs.readHead();
        Timeline target = refs.loadTimeline(name);
        if (currentName.equals(name)) {
            log.debug("already on timeline {}", name);
            return target;
        }
        boolean merging = MergeState.load(pocketDir).isPresent();
        RepoStatus status = status();
        if (!force) {
            if (merging) {
                throw new UncommittedChangesException("cannot switch to '" + name + "': a merge is in progress (finish it or use merge --abort)");
            }
            if (!status.getPiledEntries().isEmpty() || !status.getModifiedFiles().isEmpty()
                    || !status.getDeletedFiles().isEmpty()) {
                throw new UncommittedChangesException("cannot switch to '" + name
                        + "': you have uncommitted changes (shove them, or use --force to discard)");
            }
        }
        Snapshot from = headSnapshot();
        Snapshot to = snapshot(target.getHead());
        if (!force) {
            checkUntrackedOverwrite(status, to.getFiles(), Collections.emptySet(), "switch to '" + name + "'");
        }
        checkout(from, to);
        refs.writeHead(name);
        if (force) {
            pile.clear();
            savePile();
            MergeState.clear(pocketDir);
        }
        log.info("switched from {} to {}", currentName, name);
        return target;
    }

    /**
     * checkout 前检查未跟踪文件：incoming 中内容不同的同名文件、被 incoming 用作目录的文件，
     * 以及 rewritten 中会被整体改写的文件都会丢失，此时抛 UncommittedChangesException。
     *
     * @param action 出现在错误信息中的操作描述，如 "merge 'feat'"
     */
    public void checkUntrackedOverwrite(RepoStatus status, Map<String, TreeEntry> incoming, Set<String> rewritten,
                                        String action) throws PocketException, IOException {
        for (String path : status.getUntrackedFiles()) {
            TreeEntry entry = incoming.get(path);
            boolean lost = rewritten.contains(path)
                    || (entry != null && !entry.getId().equals(ObjectStore.hash(workspace.readFile(path))));
            if (!lost) {
                String prefix = path + "/";
                for (String p : incoming.keySet()) {
                    if (p.startsWith(prefix)) {
                        lost = true;
                        break;
                    }
                }
            }
            if (lost) {
                throw new UncommittedChangesException("cannot " + action + ": untracked file '"
                        + path + "' would be overwritten (move or remove it first)");
            }
        }
    }

    /**
     * 把工作区从 from 的内容更新为 to 的内容：先删除 to 中没有的已跟踪文件，
     * 再逐个写入内容不同的文件（临时文件 + 移动）。
     */
    public void checkout(Snapshot from, Snapshot to) throws PocketException, IOException {
        for (String path : from.getFiles().keySet()) {
            if (!to.contains(path) && workspace.exists(path) && !workspace.isDirectory(path)) {
                workspace.deleteFile(path);
            }
        }
        for (Map.Entry<String, TreeEntry> e : to.getFiles().entrySet()) {
            String path = e.getKey();
            TreeEntry entry = e.getValue();
            if (workspace.exists(path) && !workspace.isDirectory(path)
                    && entry.getId().equals(ObjectStore.hash(workspace.readFile(path)))
                    && workspace.getPermissions(path) == entry.getPermissions()) {
                continue;
            }
            workspace.writeFile(path, objects.get(entry.getId()), entry.getPermissions());
        }
        log.debug("checked out {} files", to.getFiles().size());
    }

    public List<Timeline> listTimelines() throws PocketException, IOException {
        return refs.listTimelines();
    }

    /** 删除 timeline；不能删除当前 timeline。 */
    public void deleteTimeline(String name) throws PocketException, IOException {
        if (!refs.timelineExists(name)) {
            throw new TimelineNotFoundException("timeline '" + name + "' not found");
        }
        if (name.equals(refs.readHead())) {
            throw new RepositoryException("cannot delete the current timeline '" + name + "'");
        }
        refs.deleteTimeline(name);
        log.info("deleted timeline {}", name);
    }

    /**
     * 从 timeline（null 为当前）的 head 沿第一父链向前，最多 limit 个（limit &lt;= 0 不限）。
     */
    public List<Shove> log(String timelineName, int limit) throws PocketException, IOException {
        Timeline timeline = timelineName == null ? getCurrentTimeline() : refs.resolveTimeline(timelineName);
        List<Shove> result = new ArrayList<>();
        Set<ShoveId> seen = new HashSet<>();
        ShoveId next = timeline.getHead();
        while (next != null && seen.add(next) && (limit <= 0 || result.size() < limit)) {
            Shove shove = refs.loadShove(next);
            result.add(shove);
            next = shove.getFirstParent();
        }
        return result;
    }

    // ---------- 路径 ----------

    /**
     * 规范化用户输入的相对路径：/ 分隔，去掉 ./ 与结尾的 /，"." 表示根。
     * 绝对路径或包含 .. 时抛 PileException。
     */
    public String normalizePath(String raw) throws PileException {
        String p = raw.replace('\\', '/').trim();
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        while (p.endsWith("/") && p.length() > 1) {
            p = p.substring(0, p.length() - 1);
        }
        if (p.equals(".")) {
            return "";
        }
        if (p.startsWith("/")) {
            String rel = workspace.relativize(Paths.get(p));
            if (rel == null) {
                throw new PileException("'" + raw + "' is outside repository " + root);
            }
            return rel;
        }
        for (String segment : p.split("/")) {
            if (segment.equals("..")) {
                throw new PileException("'" + raw + "' is outside repository " + root);
            }
        }
        return p;
    }

    /** 把命令行中相对当前目录的路径转换成相对仓库根的路径。 */
    public String relativePath(Path path) throws PileException {
        String rel = workspace.relativize(path);
        if (rel == null) {
            throw new PileException("'" + path + "' is outside repository " + root);
        }
        return rel;
    }

    // ---------- 访问器 ----------

    /**
     * 工作区根目录（即仓库根）。
     */
    public Path getRoot() {
        return root;
    }

    /**
     * .pocket 目录路径。
     */
    public Path getPocketDir() {
        return pocketDir;
    }

    public ObjectStore getObjects() {
        return objects;
    }

    public Refs getRefs() {
        return refs;
    }

    public Workspace getWorkspace() {
        return workspace;
    }

    public Config getConfig() {
        return config;
    }

    /** 写回 config.toml。 */
    public void saveConfig() throws IOException {
        config.save(pocketDir.resolve(CONFIG_FILE));
    }
}
