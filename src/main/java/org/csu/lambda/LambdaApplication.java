package org.csu.lambda;

import org.csu.lambda.config.LambdaProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(LambdaProperties.class)
public class LambdaApplication {

    public static void main(String[] args) {
        // ShellRunner 通过 ExitCodeGenerator 报告退出码
        System.exit(SpringApplication.exit(SpringApplication.run(LambdaApplication.class, args)));
    }
}
