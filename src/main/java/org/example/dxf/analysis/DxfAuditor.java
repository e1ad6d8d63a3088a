package org.example.dxf.analysis;

import org.example.dxf.DxfDocument;
import org.example.dxf.db.EntityDatabase;
import org.example.dxf.dto.DxfAuditIssue;
import org.example.dxf.dto.DxfAuditIssue.Kind;
import org.example.dxf.entity.BlockRecord;
import org.example.dxf.entity.DxfEntity;
import org.example.dxf.entity.Insert;
import org.example.dxf.schema.HandleReference;
import org.example.dxf.schema.SchemaRegistry;
import org.example.dxf.section.DxfTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 文档一致性检查：
 * <ul>
 *   <li>无法解析的句柄引用</li>
 *   <li>所有者不是块记录的图形实体（VERTEX/ATTRIB/SEQEND 的所有者是父实体）</li>
 *   <li>未定义的图层、线型，未定义的块</li>
 * </ul>
 * 审计只报告问题，不修改文档。
 */
public final class DxfAuditor {

    private static final Logger log = LoggerFactory.getLogger(DxfAuditor.class);

    private DxfAuditor() {
    }

    public static List<DxfAuditIssue> audit(DxfDocument doc) {
        EntityDatabase db = doc.database();
        DxfTable layers = doc.tables().layers();
        DxfTable linetypes = doc.tables().linetypes();
        List<DxfAuditIssue> issues = new ArrayList<>();
        for (DxfEntity e : db.entities()) {
            if (!e.isAlive()) {
                continue;
            }
            for (HandleReference ref : e.references()) {
                if (!db.contains(ref.handle())) {
                    issues.add(issue(Kind.DANGLING_REFERENCE, e, "组码 " + ref.code() + " 引用的 #"
                            + ref.handle() + " 不存在"));
                }
            }
            if (!SchemaRegistry.isGraphical(e.dxftype())) {
                continue;
            }
            checkOwner(db, e, issues);
            String layer = e.getString("layer");
            if (!layers.has(layer)) {
                issues.add(issue(Kind.UNDEFINED_LAYER, e, "图层 " + layer + " 未定义"));
            }
            if (e.hasAttr("linetype") && !linetypes.has(e.getString("linetype"))) {
                issues.add(issue(Kind.UNDEFINED_LINETYPE, e, "线型 " + e.getString("linetype") + " 未定义"));
            }
            if (e instanceof Insert insert && !doc.blocks().has(insert.blockName())) {
                issues.add(issue(Kind.UNDEFINED_BLOCK, e, "块 " + insert.blockName() + " 未定义"));
            }
        }
        if (!issues.isEmpty()) {
            log.debug("审计发现 {} 个问题", issues.size());
        }
        return issues;
    }

    private static void checkOwner(EntityDatabase db, DxfEntity e, List<DxfAuditIssue> issues) {
        Optional<DxfEntity> owner = db.resolve(e.owner());
        if (owner.isEmpty()) {
            issues.add(issue(Kind.INVALID_OWNER, e, "所有者 #" + e.owner() + " 不存在"));
        } else if (!(owner.get() instanceof BlockRecord) && !owner.get().subEntities().contains(e)) {
            issues.add(issue(Kind.INVALID_OWNER, e, "所有者 " + owner.get() + " 不是块记录"));
        }
    }

    private static DxfAuditIssue issue(Kind kind, DxfEntity e, String message) {
        return new DxfAuditIssue(kind, e.handle(), e.dxftype(), message);
    }
}
