package org.example.dxf;

import java.nio.charset.Charset;
import java.util.Objects;

/**
 * 读写 DXF 时使用的不可变选项。
 * <p>
 * Spring 环境下由 {@link DxfConfiguration} 从 {@link DxfProperties} 转换得到；脱离 Spring 使用时直接调用 {@link #defaults()}。
 *
 * @param defaultVersion            新建文档的版本
 * @param duplicateTableEntryPolicy 表记录重名时的合并策略
 * @param duplicateBlockPolicy      块名重复时的合并策略
 * @param versionPolicy             属性版本冲突策略
 * @param defaultEncoding           R2007 之前的文档没有声明 {@code $DWGCODEPAGE} 时使用的代码页
 * @param hatchPatternScale         新建图案填充 HATCH 的默认图案比例
 * @param measurement               新建文档的度量单位体系
 */
public record DxfOptions(
        DxfVersion defaultVersion,
        DuplicateNamePolicy duplicateTableEntryPolicy,
        DuplicateNamePolicy duplicateBlockPolicy,
        VersionConflictPolicy versionPolicy,
        Charset defaultEncoding,
        double hatchPatternScale,
        Measurement measurement
) {

    public DxfOptions {
        Objects.requireNonNull(defaultVersion, "defaultVersion");
        Objects.requireNonNull(duplicateTableEntryPolicy, "duplicateTableEntryPolicy");
        Objects.requireNonNull(duplicateBlockPolicy, "duplicateBlockPolicy");
        Objects.requireNonNull(versionPolicy, "versionPolicy");
        Objects.requireNonNull(defaultEncoding, "defaultEncoding");
        Objects.requireNonNull(measurement, "measurement");
        if (!(hatchPatternScale > 0)) {
            throw new IllegalArgumentException("hatchPatternScale 必须大于 0：" + hatchPatternScale);
        }
    }

    public static DxfOptions defaults() {
        return new DxfOptions(
                DxfVersion.R2013,
                DuplicateNamePolicy.FIRST_WINS,
                DuplicateNamePolicy.FIRST_WINS,
                VersionConflictPolicy.IGNORE,
                Charset.forName("cp1252"),
                1.0,
                Measurement.METRIC
        );
    }

    public DxfOptions withVersionPolicy(VersionConflictPolicy policy) {
        return new DxfOptions(defaultVersion, duplicateTableEntryPolicy, duplicateBlockPolicy, policy,
                defaultEncoding, hatchPatternScale, measurement);
    }

    public DxfOptions withDuplicateBlockPolicy(DuplicateNamePolicy policy) {
        return new DxfOptions(defaultVersion, duplicateTableEntryPolicy, policy, versionPolicy,
                defaultEncoding, hatchPatternScale, measurement);
    }

    public DxfOptions withDuplicateTableEntryPolicy(DuplicateNamePolicy policy) {
        return new DxfOptions(defaultVersion, policy, duplicateBlockPolicy, versionPolicy,
                defaultEncoding, hatchPatternScale, measurement);
    }
}
