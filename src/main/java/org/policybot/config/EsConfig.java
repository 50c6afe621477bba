package org.policybot.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.elasticsearch.client.ClientConfiguration;
import org.springframework.data.elasticsearch.client.elc.ElasticsearchConfiguration;

import java.time.Duration;

/**
 * 向量索引客户端。批量 upsert 大文档时请求较慢，socket 超时单独配置。
 */
@Configuration
public class EsConfig extends ElasticsearchConfiguration {

    @Value("${elasticsearch.host}")
    private String host;

    @Value("${elasticsearch.port}")
    private int port;

    @Value("${elasticsearch.username:}")
    private String username;

    @Value("${elasticsearch.password:}")
    private String password;

    @Value("${elasticsearch.use-ssl:false}")
    private boolean useSsl;

    @Value("${elasticsearch.connect-timeout:5s}")
    private Duration connectTimeout;

    @Value("${elasticsearch.socket-timeout:30s}")
    private Duration socketTimeout;

    @Override
    public ClientConfiguration clientConfiguration() {
        ClientConfiguration.MaybeSecureClientConfigurationBuilder builder = ClientConfiguration.builder()
                .connectedTo(host + ":" + port);
        ClientConfiguration.TerminalClientConfigurationBuilder terminal = useSsl ? builder.usingSsl() : builder;
        if (username != null && !username.isEmpty()) {
            terminal = terminal.withBasicAuth(username, password);
        }
        return terminal.withConnectTimeout(connectTimeout)
                .withSocketTimeout(socketTimeout)
                .build();
    }
}
