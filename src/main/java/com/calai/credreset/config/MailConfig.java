package com.calai.credreset.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.mail.MailProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import java.nio.charset.StandardCharsets;

/**
 * spring.mail.host 沒設時 Boot 不會自動建 JavaMailSender；
 * 這裡一律建一個，讓 dev/test 也能啟動（實際寄送由 app.password-reset.mail.enabled 控制）。
 */
@Configuration
@EnableConfigurationProperties(MailProperties.class)
public class MailConfig {

    @Bean
    @ConditionalOnMissingBean(JavaMailSender.class)
    public JavaMailSender javaMailSender(MailProperties p) {
        JavaMailSenderImpl s = new JavaMailSenderImpl();
        s.setHost(p.getHost() == null ? "localhost" : p.getHost());
        if (p.getPort() != null) s.setPort(p.getPort());
        s.setUsername(p.getUsername());
        s.setPassword(p.getPassword());
        s.setDefaultEncoding(p.getDefaultEncoding() != null
                ? p.getDefaultEncoding().name()
                : StandardCharsets.UTF_8.name());
        s.getJavaMailProperties().putAll(p.getProperties());
        return s;
    }
}
