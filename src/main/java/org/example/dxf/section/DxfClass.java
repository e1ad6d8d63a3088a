package org.example.dxf.section;

/**
 * CLASSES 段中的一个类定义。
 *
 * @param name          DXF 类型名（1）
 * @param cppName       C++ 类名（2）
 * @param appName       应用名（3）
 * @param flags         代理能力标志（90）
 * @param instanceCount 实例数（91，R2004 起）
 * @param wasAProxy     是否曾为代理（280）
 * @param isEntity      是否为图形实体（281）
 */
public record DxfClass(String name, String cppName, String appName, int flags, int instanceCount,
                       boolean wasAProxy, boolean isEntity) {

    public DxfClass withInstanceCount(int count) {
        return new DxfClass(name, cppName, appName, flags, count, wasAProxy, isEntity);
    }
}
