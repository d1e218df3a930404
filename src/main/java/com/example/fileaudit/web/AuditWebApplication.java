package com.example.fileaudit.web;

import com.example.fileaudit.AuditConfig;
import com.example.fileaudit.AuditContext;
import org.springframework.beans.factory.config.ConfigurableListableBeanFactory;
import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.context.ApplicationListener;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.event.ContextClosedEvent;

import java.util.Map;

@SpringBootApplication(exclude = DataSourceAutoConfiguration.class)
public class AuditWebApplication {
    static final String TRANSFER_TIMEOUT = "30m";

    public static ConfigurableApplicationContext start(AuditContext context, AuditConfig.Web web) {
        SpringApplication application = new SpringApplication(AuditWebApplication.class);
        application.setBannerMode(Banner.Mode.OFF);
        application.setDefaultProperties(Map.of(
                "server.address", web.host(),
                "server.port", web.port(),
                "spring.mvc.async.request-timeout", TRANSFER_TIMEOUT
        ));
        application.addInitializers(applicationContext -> {
            ConfigurableListableBeanFactory beans = applicationContext.getBeanFactory();
            beans.registerSingleton("auditStore", context.store());
            beans.registerSingleton("retrievalGateway", context.retrievalGateway());
            beans.registerSingleton("restoreOrchestrator", context.restoreOrchestrator());
        });
        ApplicationListener<ContextClosedEvent> shutdown = event -> context.close();
        application.addListeners(shutdown);
        return application.run();
    }
}
