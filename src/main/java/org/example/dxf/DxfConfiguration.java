package org.example.dxf;

import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * DXF 读写组件的 Bean 装配。
 * <p>
 * 说明：
 * <ul>
 *   <li>把 {@link DxfProperties} 转换为不可变的 {@link DxfOptions}，读写器共用同一份选项。</li>
 *   <li>应用可以声明自己的同类型 Bean 覆盖这里的默认装配。</li>
 * </ul>
 */
@AutoConfiguration
@EnableConfigurationProperties(DxfProperties.class)
public class DxfConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public DxfOptions dxfOptions(DxfProperties properties) {
        return properties.toOptions();
    }

    @Bean
    @ConditionalOnMissingBean
    public DxfReader dxfReader(DxfOptions options) {
        return new DxfReader(options);
    }

    @Bean
    @ConditionalOnMissingBean
    public DxfWriter dxfWriter(DxfOptions options) {
        return new DxfWriter(options);
    }
}
