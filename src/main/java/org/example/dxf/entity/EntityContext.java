package org.example.dxf.entity;

import org.example.dxf.DxfVersion;
import org.example.dxf.VersionConflictPolicy;

/**
 * 实体所属文档向实体暴露的最小接口：设置属性时的版本检查需要知道文档版本与冲突策略。
 */
public interface EntityContext {

    DxfVersion dxfVersion();

    VersionConflictPolicy versionPolicy();

    /**
     * 把文档版本提升到 {@code version}（已不低于时不做任何事）。
     */
    void upgradeVersion(DxfVersion version);
}
