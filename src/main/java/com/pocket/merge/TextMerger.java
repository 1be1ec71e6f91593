package com.pocket.merge;

import com.pocket.diff.DiffEngine;
import com.pocket.diff.Edit;
import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * 行级三路合并：分别计算 base→ours 与 base→theirs 的编辑脚本，
 * 转换为 base 坐标上的修改区间后逐组合并。两侧区间重叠或相接时，
 * 两侧结果相同则直接采用，否则生成冲突标记。
 */
public final class TextMerger {

    public static final String OURS_MARKER = "<<<<<<< ours";
    public static final String SEPARATOR = "=======";
    public static final String THEIRS_MARKER = ">>>>>>> theirs";

    private final DiffEngine diffEngine;

    public TextMerger(DiffEngine diffEngine) {
        this.diffEngine = diffEngine;
    }

    /** 合并结果：文本与是否包含冲突。 */
    @Value
    public static class MergedText {
        String text;
        boolean conflict;
    }

    /** base 上的一段修改：[start, end) 被 replacement 替换。 */
    @Value
    static class Region {
        int start;
        int end;
        List<String> replacement;
    }

    public MergedText merge(String base, String ours, String theirs) {
        List<String> baseLines = DiffEngine.splitLines(base);
        List<String> oursLines = DiffEngine.splitLines(ours);
        List<String> theirsLines = DiffEngine.splitLines(theirs);
        List<Region> oursRegions = regions(diffEngine.editScript(baseLines, oursLines));
        List<Region> theirsRegions = regions(diffEngine.editScript(baseLines, theirsLines));

        List<String> out = new ArrayList<>();
        boolean conflict = false;
        int pos = 0;
        int i = 0;
        int j = 0;
        while (i < oursRegions.size() || j < theirsRegions.size()) {
            boolean takeOurs = j >= theirsRegions.size()
                    || (i < oursRegions.size() && oursRegions.get(i).getStart() <= theirsRegions.get(j).getStart());
            Region seed = takeOurs ? oursRegions.get(i) : theirsRegions.get(j);
            int start = seed.getStart();
            int end = seed.getEnd();
            List<Region> oursGroup = new ArrayList<>();
            List<Region> theirsGroup = new ArrayList<>();
            boolean grew = true;
            while (grew) {
                grew = false;
                while (i < oursRegions.size() && oursRegions.get(i).getStart() <= end) {
                    Region r = oursRegions.get(i++);
                    oursGroup.add(r);
                    end = Math.max(end, r.getEnd());
                    grew = true;
                }
                while (j < theirsRegions.size() && theirsRegions.get(j).getStart() <= end) {
                    Region r = theirsRegions.get(j++);
                    theirsGroup.add(r);
                    end = Math.max(end, r.getEnd());
                    grew = true;
                }
            }
            out.addAll(baseLines.subList(pos, start));
            List<String> oursText = apply(baseLines, start, end, oursGroup);
            List<String> theirsText = apply(baseLines, start, end, theirsGroup);
            if (theirsGroup.isEmpty()) {
                out.addAll(oursText);
            } else if (oursGroup.isEmpty() || oursText.equals(theirsText)) {
                out.addAll(theirsText);
            } else {
                conflict = true;
                out.add(OURS_MARKER);
                out.addAll(oursText);
                out.add(SEPARATOR);
                out.addAll(theirsText);
                out.add(THEIRS_MARKER);
            }
            pos = end;
        }
        out.addAll(baseLines.subList(pos, baseLines.size()));
        return new MergedText(join(out, endsWithNewline(base, ours, theirs)), conflict);
    }

    /**
     * 整个文件的冲突标记，用于无法按行合并的情况。
     */
    public static String conflictMarkers(String ours, String theirs) {
        StringBuilder sb = new StringBuilder();
        sb.append(OURS_MARKER).append('\n');
        appendBlock(sb, ours);
        sb.append(SEPARATOR).append('\n');
        appendBlock(sb, theirs);
        sb.append(THEIRS_MARKER).append('\n');
        return sb.toString();
    }

    private static void appendBlock(StringBuilder sb, String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        sb.append(text);
        if (!text.endsWith("\n")) {
            sb.append('\n');
        }
    }

    /** 把编辑脚本中连续的非 KEEP 步骤收集为 base 上的区间。 */
    static List<Region> regions(List<Edit> script) {
        List<Region> regions = new ArrayList<>();
        int basePos = 0;
        int idx = 0;
        while (idx < script.size()) {
            Edit e = script.get(idx);
            if (e.isKeep()) {
                basePos = e.getOldIndex() + 1;
                idx++;
                continue;
            }
            int start = basePos;
            int deleted = 0;
            List<String> inserted = new ArrayList<>();
            while (idx < script.size() && !script.get(idx).isKeep()) {
                Edit c = script.get(idx);
                if (c.getType() == Edit.Type.DELETE) {
                    deleted++;
                } else {
                    inserted.add(c.getText());
                }
                idx++;
            }
            basePos = start + deleted;
            regions.add(new Region(start, start + deleted, inserted));
        }
        return regions;
    }

    private static List<String> apply(List<String> base, int start, int end, List<Region> group) {
        List<String> result = new ArrayList<>();
        int p = start;
        for (Region r : group) {
            result.addAll(base.subList(p, r.getStart()));
            result.addAll(r.getReplacement());
            p = r.getEnd();
        }
        result.addAll(base.subList(p, end));
        return result;
    }

    private static boolean endsWithNewline(String base, String ours, String theirs) {
        for (String s : new String[]{ours, theirs, base}) {
            if (s != null && !s.isEmpty()) {
                return s.endsWith("\n");
            }
        }
        return false;
    }

    private static String join(List<String> lines, boolean trailingNewline) {
        if (lines.isEmpty()) {
            return "";
        }
        String joined = String.join("\n", lines);
        return trailingNewline ? joined + "\n" : joined;
    }
}
