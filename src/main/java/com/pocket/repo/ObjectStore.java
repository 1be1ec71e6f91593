package com.pocket.repo;

import com.pocket.exception.CorruptObjectException;
import com.pocket.exception.ObjectException;
import com.pocket.exception.ObjectNotFoundException;
import com.pocket.obj.ObjectId;
import com.pocket.obj.Tree;
import com.pocket.obj.TreeEntry;
import com.pocket.utils.FileUtils;
import com.pocket.utils.TomlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * .pocket/objects 存储：按内容的 SHA-256 写入/读取对象，路径为 objects/xx/yyyy...。
 * 对象写入后不可变：同一路径已存在时不再写入。
 * 文件内容与 tree 都以原始字节存储，tree 是序列化后的 TOML。
 */
public final class ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(ObjectStore.class);

    private static final String OBJECTS_DIR = "objects";
    private final Path objectsDir;

    /**
     * 以 .pocket 目录为基准，对象存储路径为 .pocket/objects。
     */
    public ObjectStore(Path pocketDir) {
        this.objectsDir = pocketDir.resolve(OBJECTS_DIR);
    }

    /** 计算内容的 id，不写入。 */
    public static ObjectId hash(byte[] content) {
        return ObjectId.forContent(content);
    }

    /**
     * 存储对象，返回 id。对象已存在时直接返回（写一次）。
     * 先写入分片目录下的临时文件再原子移动，并发写同一对象结果一致。
     */
    public ObjectId store(byte[] content) throws IOException {
        ObjectId id = hash(content);
        Path objectPath = objectPath(id);
        if (Files.exists(objectPath)) {
            log.debug("object exists id={}", id.shortHex());
            return id;
        }
        FileUtils.writeAtomically(objectPath, content);
        log.debug("stored object id={} size={}", id.shortHex(), content.length);
        return id;
    }

    /** 读取工作区文件并存储。 */
    public ObjectId storeFile(Path file) throws IOException {
        return store(Files.readAllBytes(file));
    }

    /**
     * 读取对象字节；不存在时抛 ObjectNotFoundException，内容与 id 不符时抛 CorruptObjectException。
     */
    public byte[] get(ObjectId id) throws ObjectException, IOException {
        Path p = objectPath(id);
        if (!Files.exists(p)) {
            throw new ObjectNotFoundException("object not found: " + id);
        }
        byte[] content = Files.readAllBytes(p);
        if (!hash(content).equals(id)) {
            throw new CorruptObjectException("object " + id + " does not match its content hash");
        }
        return content;
    }

    /** 对象是否存在。 */
    public boolean has(ObjectId id) {
        return Files.exists(objectPath(id));
    }

    /** 将 tree 序列化为 TOML 后作为普通对象存储。 */
    public ObjectId storeTree(Tree tree) throws IOException {
        return store(TomlUtils.toBytes(tree));
    }

    /** 读取并解析 tree 对象；内容不是合法 tree 时抛 CorruptObjectException。 */
    public Tree getTree(ObjectId id) throws ObjectException, IOException {
        byte[] content = get(id);
        try {
            Tree tree = TomlUtils.fromBytes(content, Tree.class);
            if (tree == null || tree.getEntries() == null) {
                throw new CorruptObjectException("object " + id + " is not a tree");
            }
            for (TreeEntry entry : tree.getEntries()) {
                if (entry == null || !TreeEntry.isValidName(entry.getName()) || entry.getId() == null
                        || entry.getEntryType() == null) {
                    throw new CorruptObjectException("tree " + id + " has an invalid entry"
                            + (entry != null ? " '" + entry.getName() + "'" : ""));
                }
            }
            return tree;
        } catch (IOException e) {
            throw new CorruptObjectException("object " + id + " is not a tree: " + e.getMessage(), e);
        }
    }

    /**
     * 根据 id 得到 .pocket/objects/xx/yyyy... 路径（前 2 字符为子目录）。
     */
    Path objectPath(ObjectId id) {
        return objectsDir.resolve(id.shard()).resolve(id.rest());
    }
}
