package com.hookledger.gateway;

import com.hookledger.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.hookledger")
public class HookLedgerApp {

    private static final Logger log = LoggerFactory.getLogger(HookLedgerApp.class);

    public static void main(String[] args) {
        var config = ConfigLoader.load();
        config.validate().ifPresent(problem -> log.warn("{}; /health/ready will report not ready", problem));

        var app = new SpringApplication(HookLedgerApp.class);
        app.setDefaultProperties(Map.of(
            "server.port", String.valueOf(config.serverPort()),
            "logging.level.com.hookledger", config.logLevel()
        ));
        app.addInitializers(ctx -> ctx.getBeanFactory().registerSingleton("hookLedgerConfig", config));
        app.run(args);
    }
}
