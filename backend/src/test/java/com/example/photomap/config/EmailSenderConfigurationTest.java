package com.example.photomap.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;

import static org.assertj.core.api.Assertions.assertThat;

class EmailSenderConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(TestConfig.class);

    @Test
    void noMailSenderUnlessSmtpChannelSelected() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(JavaMailSender.class));
    }

    @Test
    void smtpChannelBuildsSenderFromMailProperties() {
        contextRunner
                .withPropertyValues(
                        "app.notifier.channel=smtp",
                        "app.mail.host=smtp.example.com",
                        "app.mail.port=2525",
                        "app.mail.start-tls=true")
                .run(context -> {
                    JavaMailSenderImpl sender = (JavaMailSenderImpl) context.getBean(JavaMailSender.class);
                    assertThat(sender.getHost()).isEqualTo("smtp.example.com");
                    assertThat(sender.getPort()).isEqualTo(2525);
                    assertThat(sender.getUsername()).isNull();
                    assertThat(sender.getJavaMailProperties())
                            .containsEntry("mail.smtp.starttls.enable", "true")
                            .containsEntry("mail.smtp.timeout", "5000");
                });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(EmailSenderProperties.class)
    @Import(EmailSenderConfiguration.class)
    static class TestConfig { }
}
