package com.imperium.mindjournal.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

@Configuration
@MapperScan("com.imperium.mindjournal.mapper")
public class MybatisPlusConfig {
}
