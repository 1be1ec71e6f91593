package com.pocket.diff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 行级 diff：Myers O(ND) 算法求最短编辑脚本，再按上下文行数分组为 hunk。
 */
public final class DiffEngine {

    private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);

    /**
     * 比较两个文本。任一侧包含 NUL 时视为二进制，不计算 hunk。
     * 文本为 null 表示该侧文件不存在（按空文件处理）。
     */
    public DiffResult diff(String oldPath, String oldText, String newPath, String newText, DiffOptions options) {
        String a = oldText != null ? oldText : "";
        String b = newText != null ? newText : "";
        if (a.indexOf('\0') >= 0 || b.indexOf('\0') >= 0) {
            log.debug("binary diff {} -> {}", oldPath, newPath);
            return new DiffResult(oldPath, newPath, true, List.of());
        }
        List<Edit> script = editScript(splitLines(a), splitLines(b), options);
        List<DiffHunk> hunks = buildHunks(script, options.getContextLines());
        log.debug("diff {} -> {} edits={} hunks={}", oldPath, newPath, script.size(), hunks.size());
        return new DiffResult(oldPath, newPath, false, hunks);
    }

    /** 比较两段字节内容（按 UTF-8 解码）。 */
    public DiffResult diff(String oldPath, byte[] oldContent, String newPath, byte[] newContent, DiffOptions options) {
        if (isBinary(oldContent) || isBinary(newContent)) {
            return new DiffResult(oldPath, newPath, true, List.of());
        }
        return diff(oldPath, decode(oldContent), newPath, decode(newContent), options);
    }

    /** 内容中含 NUL 字节即视为二进制。 */
    public static boolean isBinary(byte[] content) {
        if (content == null) {
            return false;
        }
        for (byte b : content) {
            if (b == 0) {
                return true;
            }
        }
        return false;
    }

    private static String decode(byte[] content) {
        return content == null ? null : new String(content, StandardCharsets.UTF_8);
    }

    /**
     * 按 \n 切分为行；末尾换行不产生空行。
     */
    public static List<String> splitLines(String text) {
        List<String> lines = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return lines;
        }
        int start = 0;
        int nl;
        while ((nl = text.indexOf('\n', start)) >= 0) {
            lines.add(text.substring(start, nl));
            start = nl + 1;
        }
        if (start < text.length()) {
            lines.add(text.substring(start));
        }
        return lines;
    }

    /** 按精确相等比较行的编辑脚本。 */
    public List<Edit> editScript(List<String> a, List<String> b) {
        return editScript(a, b, DiffOptions.defaults());
    }

    /**
     * Myers 最短编辑脚本，线性空间版本：先剥离公共前后缀，再用正反两个方向同时推进的
     * V 数组找到中间蛇形，对两侧递归。内存只与输入行数成正比。
     */
    public List<Edit> editScript(List<String> a, List<String> b, DiffOptions options) {
        Script script = new Script(a, b, keys(a, options), keys(b, options));
        script.compare(0, a.size(), 0, b.size());
        return script.ordered();
    }

    private static final class Script {
        private final List<String> a;
        private final List<String> b;
        private final List<String> ka;
        private final List<String> kb;
        private final List<Edit> edits = new ArrayList<>();

        Script(List<String> a, List<String> b, List<String> ka, List<String> kb) {
            this.a = a;
            this.b = b;
            this.ka = ka;
            this.kb = kb;
        }

        private boolean same(int x, int y) {
            return ka.get(x).equals(kb.get(y));
        }

        void compare(int aLo, int aHi, int bLo, int bHi) {
            while (aLo < aHi && bLo < bHi && same(aLo, bLo)) {
                edits.add(new Edit(Edit.Type.KEEP, aLo, bLo, a.get(aLo)));
                aLo++;
                bLo++;
            }
            int suffix = 0;
            while (aHi > aLo && bHi > bLo && same(aHi - 1, bHi - 1)) {
                aHi--;
                bHi--;
                suffix++;
            }
            if (aLo == aHi) {
                for (int y = bLo; y < bHi; y++) {
                    edits.add(new Edit(Edit.Type.INSERT, aLo, y, b.get(y)));
                }
            } else if (bLo == bHi) {
                for (int x = aLo; x < aHi; x++) {
                    edits.add(new Edit(Edit.Type.DELETE, x, bLo, a.get(x)));
                }
            } else {
                // 剥离前后缀后两侧都非空，编辑距离至少为 2，两半都严格变小
                int[] snake = middleSnake(aLo, aHi, bLo, bHi);
                compare(aLo, snake[0], bLo, snake[1]);
                for (int x = snake[0], y = snake[1]; x < snake[2]; x++, y++) {
                    edits.add(new Edit(Edit.Type.KEEP, x, y, a.get(x)));
                }
                compare(snake[2], aHi, snake[3], bHi);
            }
            for (int i = 0; i < suffix; i++) {
                edits.add(new Edit(Edit.Type.KEEP, aHi + i, bHi + i, a.get(aHi + i)));
            }
        }

        /**
         * 返回中间蛇形的起点与终点 {x0, y0, x1, y1}（绝对行号）。
         * 反向数组按翻转后的坐标记录，正向对角线 k 对应反向对角线 delta - k。
         */
        private int[] middleSnake(int aLo, int aHi, int bLo, int bHi) {
            int n = aHi - aLo;
            int m = bHi - bLo;
            int delta = n - m;
            boolean odd = (delta & 1) != 0;
            int max = (n + m + 1) / 2;
            int offset = max + 1;
            int[] vf = new int[2 * max + 3];
            int[] vb = new int[2 * max + 3];

            for (int d = 0; d <= max; d++) {
                for (int k = -d; k <= d; k += 2) {
                    int x = (k == -d || (k != d && vf[offset + k - 1] < vf[offset + k + 1]))
                            ? vf[offset + k + 1] : vf[offset + k - 1] + 1;
                    int y = x - k;
                    int x0 = x;
                    int y0 = y;
                    while (x < n && y < m && same(aLo + x, bLo + y)) {
                        x++;
                        y++;
                    }
                    vf[offset + k] = x;
                    int kr = delta - k;
                    if (odd && kr >= -(d - 1) && kr <= d - 1 && x + vb[offset + kr] >= n) {
                        return new int[]{aLo + x0, bLo + y0, aLo + x, bLo + y};
                    }
                }
                for (int k = -d; k <= d; k += 2) {
                    int x = (k == -d || (k != d && vb[offset + k - 1] < vb[offset + k + 1]))
                            ? vb[offset + k + 1] : vb[offset + k - 1] + 1;
                    int y = x - k;
                    int x0 = x;
                    int y0 = y;
                    while (x < n && y < m && same(aHi - 1 - x, bHi - 1 - y)) {
                        x++;
                        y++;
                    }
                    vb[offset + k] = x;
                    int kf = delta - k;
                    if (!odd && kf >= -d && kf <= d && vf[offset + kf] + x >= n) {
                        return new int[]{aLo + n - x, bLo + m - y, aLo + n - x0, bLo + m - y0};
                    }
                }
            }
            throw new IllegalStateException("edit script not found");
        }

        /**
         * 每段连续变化内 DELETE 排在 INSERT 之前，并按新顺序改写另一侧的插入位置：
         * DELETE 的 newIndex 为该段在新文本中的起点，INSERT 的 oldIndex 为该段在旧文本中的终点。
         */
        List<Edit> ordered() {
            List<Edit> result = new ArrayList<>(edits.size());
            List<Edit> deletes = new ArrayList<>();
            List<Edit> inserts = new ArrayList<>();
            int runStartNew = -1;
            int runEndOld = -1;
            for (Edit e : edits) {
                if (e.isKeep()) {
                    flush(result, deletes, inserts, runStartNew, runEndOld);
                    runStartNew = -1;
                    result.add(e);
                    continue;
                }
                if (runStartNew < 0) {
                    runStartNew = e.getNewIndex();
                    runEndOld = e.getOldIndex();
                }
                if (e.getType() == Edit.Type.DELETE) {
                    deletes.add(e);
                    runEndOld = e.getOldIndex() + 1;
                } else {
                    inserts.add(e);
                }
            }
            flush(result, deletes, inserts, runStartNew, runEndOld);
            return result;
        }

        private static void flush(List<Edit> result, List<Edit> deletes, List<Edit> inserts,
                                  int runStartNew, int runEndOld) {
            for (Edit d : deletes) {
                result.add(new Edit(Edit.Type.DELETE, d.getOldIndex(), runStartNew, d.getText()));
            }
            for (Edit i : inserts) {
                result.add(new Edit(Edit.Type.INSERT, runEndOld, i.getNewIndex(), i.getText()));
            }
            deletes.clear();
            inserts.clear();
        }
    }

    private static List<String> keys(List<String> lines, DiffOptions options) {
        if (!options.isIgnoreWhitespace() && !options.isIgnoreCase()) {
            return lines;
        }
        List<String> keys = new ArrayList<>(lines.size());
        for (String line : lines) {
            String key = line;
            if (options.isIgnoreWhitespace()) {
                key = key.trim().replaceAll("\\s+", " ");
            }
            if (options.isIgnoreCase()) {
                key = key.toLowerCase(Locale.ROOT);
            }
            keys.add(key);
        }
        return keys;
    }

    /**
     * 把编辑脚本按上下文分组：两处变化之间的 KEEP 不超过 2 * context 行时合并为同一个 hunk。
     */
    List<DiffHunk> buildHunks(List<Edit> script, int context) {
        int ctx = Math.max(0, context);
        List<DiffHunk> hunks = new ArrayList<>();
        int i = 0;
        while (i < script.size()) {
            while (i < script.size() && script.get(i).isKeep()) {
                i++;
            }
            if (i >= script.size()) {
                break;
            }
            int start = Math.max(0, i - ctx);
            int lastChange = i;
            int j = i;
            while (j < script.size()) {
                if (!script.get(j).isKeep()) {
                    lastChange = j;
                    j++;
                    continue;
                }
                int keepRun = 0;
                int k = j;
                while (k < script.size() && script.get(k).isKeep()) {
                    keepRun++;
                    k++;
                }
                if (k >= script.size() || keepRun > 2 * ctx) {
                    break;
                }
                j = k;
            }
            int end = Math.min(script.size(), lastChange + ctx + 1);
            hunks.add(toHunk(script.subList(start, end)));
            i = end;
        }
        return hunks;
    }

    private static DiffHunk toHunk(List<Edit> edits) {
        Edit first = edits.get(0);
        int oldPos = first.getOldIndex();
        int newPos = first.getNewIndex();
        int oldCount = 0;
        int newCount = 0;
        List<DiffLine> lines = new ArrayList<>();
        List<DiffChange> changes = new ArrayList<>();
        int idx = 0;
        while (idx < edits.size()) {
            Edit e = edits.get(idx);
            if (e.isKeep()) {
                lines.add(new DiffLine(' ', e.getText()));
                oldCount++;
                newCount++;
                idx++;
                continue;
            }
            List<String> removed = new ArrayList<>();
            List<String> added = new ArrayList<>();
            int removedStart = -1;
            int addedStart = -1;
            while (idx < edits.size() && !edits.get(idx).isKeep()) {
                Edit c = edits.get(idx);
                if (c.getType() == Edit.Type.DELETE) {
                    if (removedStart < 0) {
                        removedStart = c.getOldIndex() + 1;
                    }
                    removed.add(c.getText());
                    oldCount++;
                } else {
                    if (addedStart < 0) {
                        addedStart = c.getNewIndex() + 1;
                    }
                    added.add(c.getText());
                    newCount++;
                }
                idx++;
            }
            for (String r : removed) {
                lines.add(new DiffLine('-', r));
            }
            for (String a : added) {
                lines.add(new DiffLine('+', a));
            }
            if (!removed.isEmpty() && !added.isEmpty()) {
                changes.add(new DiffChange.Changed(removedStart, List.copyOf(removed), addedStart, List.copyOf(added)));
            } else if (!removed.isEmpty()) {
                changes.add(new DiffChange.Removed(removedStart, List.copyOf(removed)));
            } else {
                changes.add(new DiffChange.Added(addedStart, List.copyOf(added)));
            }
        }
        int oldStart = oldCount == 0 ? oldPos : oldPos + 1;
        int newStart = newCount == 0 ? newPos : newPos + 1;
        return new DiffHunk(oldStart, oldCount, newStart, newCount, List.copyOf(changes), List.copyOf(lines));
    }

    /**
     * 渲染为 unified diff 文本。
     */
    public static String format(DiffResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("--- ").append(result.getOldPath() != null ? "a/" + result.getOldPath() : "/dev/null").append('\n');
        sb.append("+++ ").append(result.getNewPath() != null ? "b/" + result.getNewPath() : "/dev/null").append('\n');
        if (result.isBinary()) {
            sb.append("Binary files differ\n");
            return sb.toString();
        }
        for (DiffHunk hunk : result.getHunks()) {
            sb.append(hunk.header()).append('\n');
            for (DiffLine line : hunk.getLines()) {
                sb.append(line.getMarker()).append(line.getText()).append('\n');
            }
        }
        return sb.toString();
    }
}
