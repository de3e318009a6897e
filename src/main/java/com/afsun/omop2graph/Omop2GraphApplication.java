package com.afsun.omop2graph;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * OMOP 词表迁移到 Neo4j 图库的命令行入口
 *
 * @author afsun
 */
@SpringBootApplication(scanBasePackages = "com.afsun.omop2graph")
@ConfigurationPropertiesScan
public class Omop2GraphApplication {
    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(Omop2GraphApplication.class, args)));
    }
}
