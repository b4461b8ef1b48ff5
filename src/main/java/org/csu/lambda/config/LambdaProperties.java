package org.csu.lambda.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * application.properties 中以 "lambda." 开头的配置项。
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "lambda")
public class LambdaProperties {

    /**
     * 批处理模式下最多归约多少步，0 表示不限制 (不终止的项会一直运行)。
     */
    private int maxSteps = 0;

    /**
     * 批处理模式下是否打印每一步。
     */
    private boolean trace = false;

    /**
     * 输出时是否使用 ANSI 颜色。
     */
    private boolean color = true;
}
