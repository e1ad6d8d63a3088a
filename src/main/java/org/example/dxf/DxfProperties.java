package org.example.dxf;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.charset.Charset;

/**
 * DXF 读写配置（{@code app.dxf.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>{@link #duplicateTableEntryPolicy}/{@link #duplicateBlockPolicy} 决定读入时重名定义的合并方式。</li>
 *   <li>{@link #versionPolicy} 决定属性最低版本高于文档版本时的行为。</li>
 * </ul>
 * 通过 {@link #toOptions()} 转换为不可变的 {@link DxfOptions}。
 */
@Validated
@ConfigurationProperties(prefix = "app.dxf")
public class DxfProperties {

    /**
     * 新建文档的 DXF 版本。
     */
    @NotNull
    private DxfVersion defaultVersion = DxfVersion.R2013;

    /**
     * 表记录重名（不区分大小写）时保留哪一条。
     */
    @NotNull
    private DuplicateNamePolicy duplicateTableEntryPolicy = DuplicateNamePolicy.FIRST_WINS;

    /**
     * 块名重复时保留哪一个定义。
     */
    @NotNull
    private DuplicateNamePolicy duplicateBlockPolicy = DuplicateNamePolicy.FIRST_WINS;

    @NotNull
    private VersionConflictPolicy versionPolicy = VersionConflictPolicy.IGNORE;

    /**
     * R2007 之前的文件没有声明 {@code $DWGCODEPAGE} 时使用的字符集。
     */
    @NotBlank
    private String defaultEncoding = "cp1252";

    /**
     * 新建图案填充的默认图案比例。
     */
    @DecimalMin(value = "0", inclusive = false)
    private double hatchPatternScale = 1.0;

    /**
     * 新建文档写入 {@code $MEASUREMENT} 的单位体系。
     */
    @NotNull
    private Measurement measurement = Measurement.METRIC;

    /**
     * @throws java.nio.charset.UnsupportedCharsetException {@link #defaultEncoding} 不是当前 JVM 支持的字符集
     */
    public DxfOptions toOptions() {
        return new DxfOptions(
                defaultVersion,
                duplicateTableEntryPolicy,
                duplicateBlockPolicy,
                versionPolicy,
                Charset.forName(defaultEncoding),
                hatchPatternScale,
                measurement
        );
    }

    public DxfVersion getDefaultVersion() {
        return defaultVersion;
    }

    public void setDefaultVersion(DxfVersion defaultVersion) {
        this.defaultVersion = defaultVersion;
    }

    public DuplicateNamePolicy getDuplicateTableEntryPolicy() {
        return duplicateTableEntryPolicy;
    }

    public void setDuplicateTableEntryPolicy(DuplicateNamePolicy duplicateTableEntryPolicy) {
        this.duplicateTableEntryPolicy = duplicateTableEntryPolicy;
    }

    public DuplicateNamePolicy getDuplicateBlockPolicy() {
        return duplicateBlockPolicy;
    }

    public void setDuplicateBlockPolicy(DuplicateNamePolicy duplicateBlockPolicy) {
        this.duplicateBlockPolicy = duplicateBlockPolicy;
    }

    public VersionConflictPolicy getVersionPolicy() {
        return versionPolicy;
    }

    public void setVersionPolicy(VersionConflictPolicy versionPolicy) {
        this.versionPolicy = versionPolicy;
    }

    public String getDefaultEncoding() {
        return defaultEncoding;
    }

    public void setDefaultEncoding(String defaultEncoding) {
        this.defaultEncoding = defaultEncoding;
    }

    public double getHatchPatternScale() {
        return hatchPatternScale;
    }

    public void setHatchPatternScale(double hatchPatternScale) {
        this.hatchPatternScale = hatchPatternScale;
    }

    public Measurement getMeasurement() {
        return measurement;
    }

    public void setMeasurement(Measurement measurement) {
        this.measurement = measurement;
    }
}
