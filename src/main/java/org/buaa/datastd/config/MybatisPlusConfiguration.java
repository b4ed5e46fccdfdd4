package org.buaa.datastd.config;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.context.annotation.Configuration;

/**
 * MyBatis-Plus 配置
 */
@Configuration
@MapperScan("org.buaa.datastd.dao.mapper")
public class MybatisPlusConfiguration {
}
