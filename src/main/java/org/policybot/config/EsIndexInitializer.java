package org.policybot.config;

import org.apache.http.ConnectionClosedException;
import org.policybot.service.ElasticsearchService;
import org.policybot.utils.LogUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

// 启动时创建向量索引
@Component
public class EsIndexInitializer implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(EsIndexInitializer.class);

    private final ElasticsearchService elasticsearchService;

    public EsIndexInitializer(ElasticsearchService elasticsearchService) {
        this.elasticsearchService = elasticsearchService;
    }

    @Override
    public void run(String... args) throws Exception {
        try {
            elasticsearchService.ensureIndexExists();
            LogUtils.logSystemStart("Elasticsearch", "READY", "索引已就绪");
        } catch (Exception exception) {
            // 连接被关闭时等待后重试一次
            if (exception instanceof ConnectionClosedException || exception.getCause() instanceof ConnectionClosedException) {
                logger.error("Elasticsearch连接已关闭，等待5秒后重试...");
                Thread.sleep(5000);
                try {
                    elasticsearchService.ensureIndexExists();
                } catch (Exception retryException) {
                    throw new IllegalStateException("初始化索引失败，重试也未能成功", retryException);
                }
            } else {
                throw new IllegalStateException("初始化索引失败", exception);
            }
        }
    }
}
