package org.example.dxf.structure;

import org.example.dxf.DxfStructureException;
import org.example.dxf.tag.DxfTag;
import org.example.dxf.tag.GroupCodes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 分类后的实体 tag 组：把一个实体的扁平 tag 序列拆成结构单元。
 * <p>
 * 拆分规则：
 * <ul>
 *   <li><b>基类</b>：第一个 {@code (100, ...)} 之前的 tag，包含 {@code (0, 类型)}、句柄、所有者</li>
 *   <li><b>应用数据</b>：基类中 {@code (102, "{APPID") ... (102, "}")} 包围的内容（含扩展字典与持久反应器）</li>
 *   <li><b>子类</b>：每个 {@code (100, 名称)} 开始一个子类，同一组码在不同子类中含义不同</li>
 *   <li><b>嵌入对象</b>：{@code (101, "Embedded Object")} 之后直到 XDATA 的内容</li>
 *   <li><b>XDATA</b>：从第一个 {@code (1001, APPID)} 到结尾，按 APPID 分块</li>
 * </ul>
 * 子类中出现的 102 控制组不单独提取，但同样要求配对。
 * R12 文件按“扁平”方式分类：忽略子类标记，全部内容归入基类。
 */
public final class TagGroup {

    /**
     * 基类中的应用数据块（不含起止的 102 标记）。
     */
    public record AppData(String appid, List<DxfTag> tags) {
    }

    public record Subclass(String name, List<DxfTag> tags) {
    }

    /**
     * XDATA 块（不含 1001 本身）。
     */
    public record XDataBlock(String appid, List<DxfTag> tags) {
    }

    private final String dxftype;
    private final List<DxfTag> base = new ArrayList<>();
    private final List<AppData> appData = new ArrayList<>();
    private final List<Subclass> subclasses = new ArrayList<>();
    private final List<List<DxfTag>> embeddedObjects = new ArrayList<>();
    private final List<XDataBlock> xdata = new ArrayList<>();
    private int strippedMarkers;

    private TagGroup(String dxftype) {
        this.dxftype = dxftype;
    }

    public static TagGroup classify(List<DxfTag> tags) {
        return classify(tags, false);
    }

    /**
     * @param flatten 为 {@code true} 时忽略 {@code (100, ...)} 子类标记（R12）
     */
    public static TagGroup classify(List<DxfTag> tags, boolean flatten) {
        if (tags.isEmpty() || tags.get(0).code() != GroupCodes.STRUCTURE) {
            throw new DxfStructureException("实体必须以 (0, 类型) 开头", tags.isEmpty() ? -1 : tags.get(0).line());
        }
        TagGroup group = new TagGroup(tags.get(0).stringValue());
        group.base.add(tags.get(0));
        List<DxfTag> current = group.base;
        int i = 1;
        int n = tags.size();
        while (i < n) {
            DxfTag tag = tags.get(i);
            int code = tag.code();
            if (code == GroupCodes.CONTROL && tag.stringValue().startsWith("{")) {
                int end = findControlEnd(tags, i, group.dxftype);
                if (current == group.base) {
                    String appid = tag.stringValue().substring(1);
                    group.appData.add(new AppData(appid, List.copyOf(tags.subList(i + 1, end))));
                } else {
                    current.addAll(tags.subList(i, end + 1));
                }
                i = end + 1;
                continue;
            }
            if (code == GroupCodes.SUBCLASS_MARKER) {
                if (flatten) {
                    group.strippedMarkers++;
                } else {
                    Subclass subclass = new Subclass(tag.stringValue(), new ArrayList<>());
                    group.subclasses.add(subclass);
                    current = subclass.tags();
                }
                i++;
                continue;
            }
            if (code == GroupCodes.EMBEDDED_OBJECT) {
                current = new ArrayList<>();
                group.embeddedObjects.add(current);
                i++;
                continue;
            }
            if (code == GroupCodes.XDATA_APPID) {
                group.collectXData(tags, i);
                break;
            }
            current.add(tag);
            i++;
        }
        return group;
    }

    private static int findControlEnd(List<DxfTag> tags, int start, String dxftype) {
        String open = tags.get(start).stringValue();
        for (int j = start + 1; j < tags.size(); j++) {
            DxfTag t = tags.get(j);
            if (t.code() != GroupCodes.CONTROL) {
                continue;
            }
            String v = t.stringValue();
            if ("}".equals(v) || v.endsWith("}")) {
                return j;
            }
            if (v.startsWith("{")) {
                break;
            }
        }
        throw new DxfStructureException("控制组 (102, \"" + open + "\") 缺少结束标记 (102, \"}\")",
                tags.get(start).line()).withEntity(dxftype, null);
    }

    private void collectXData(List<DxfTag> tags, int start) {
        XDataBlock block = null;
        for (int j = start; j < tags.size(); j++) {
            DxfTag t = tags.get(j);
            if (t.code() == GroupCodes.XDATA_APPID) {
                block = new XDataBlock(t.stringValue(), new ArrayList<>());
                xdata.add(block);
            } else if (t.code() < 1000) {
                throw new DxfStructureException("XDATA 中出现非法组码 " + t.code(), t.line()).withEntity(dxftype, null);
            } else {
                block.tags().add(t);
            }
        }
    }

    public String dxftype() {
        return dxftype;
    }

    /**
     * @return 基类 tag（含 {@code (0, 类型)}，不含应用数据块）
     */
    public List<DxfTag> base() {
        return Collections.unmodifiableList(base);
    }

    public List<AppData> appData() {
        return Collections.unmodifiableList(appData);
    }

    public List<Subclass> subclasses() {
        return Collections.unmodifiableList(subclasses);
    }

    public List<List<DxfTag>> embeddedObjects() {
        return Collections.unmodifiableList(embeddedObjects);
    }

    public List<XDataBlock> xdata() {
        return Collections.unmodifiableList(xdata);
    }

    /**
     * @return 没有子类标记（R12 或省略了子类标记的文件）
     */
    public boolean isFlat() {
        return subclasses.isEmpty();
    }

    /**
     * @return 扁平化时丢弃的子类标记数量
     */
    public int strippedMarkers() {
        return strippedMarkers;
    }

    /**
     * @return 基类中的句柄（组码 5 或 DIMSTYLE 使用的 105）；没有时返回 {@code null}
     */
    public String handle() {
        for (DxfTag t : base) {
            if (t.code() == GroupCodes.HANDLE || t.code() == GroupCodes.DIMSTYLE_HANDLE) {
                return t.stringValue();
            }
        }
        return null;
    }

    /**
     * 在基类中查找第一个指定组码的 tag（扁平实体即在全部内容中查找）。
     */
    public DxfTag findBase(int code) {
        for (DxfTag t : base) {
            if (t.code() == code) {
                return t;
            }
        }
        return null;
    }

    /**
     * 在所有子类（扁平实体为基类）中查找第一个指定组码的 tag。
     */
    public DxfTag find(int code) {
        if (isFlat()) {
            return findBase(code);
        }
        for (Subclass s : subclasses) {
            for (DxfTag t : s.tags()) {
                if (t.code() == code) {
                    return t;
                }
            }
        }
        return null;
    }
}
