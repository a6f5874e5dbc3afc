package com.asiainfo.analytics;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 应用程序主类
 * Quarkus启动入口
 */
@QuarkusMain
public class Application {

    public static void main(String[] args) {
        Quarkus.run(App.class, args);
    }

    /**
     * 应用程序实例
     */
    public static class App implements QuarkusApplication {

        private static final Logger log = LoggerFactory.getLogger(App.class);

        @Override
        public int run(String... args) throws Exception {
            log.info("==================================================");
            log.info("  BI Aggregation Runtime");
            log.info("  两级缓存 (Caffeine + Redis) + SQLite 聚合 + ETL 模拟");
            log.info("==================================================");

            Quarkus.waitForExit();
            return 0;
        }
    }
}
