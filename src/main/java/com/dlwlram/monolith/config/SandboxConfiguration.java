package com.dlwlram.monolith.config;

import cn.hutool.core.util.StrUtil;
import com.dlwlram.monolith.language.LanguageProfileTable;
import com.dlwlram.monolith.profile.MemoryProfileAccountant;
import com.dlwlram.monolith.provider.EnvironmentProvider;
import com.dlwlram.monolith.provider.docker.DockerEnvironmentProvider;
import com.dlwlram.monolith.timeout.TimeoutSupervisor;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.httpclient5.ApacheDockerHttpClient;
import com.github.dockerjava.transport.DockerHttpClient;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SandboxProperties.class)
public class SandboxConfiguration {

    @Bean
    public DockerClient dockerClient(SandboxProperties sandboxProperties) {
        DefaultDockerClientConfig.Builder configBuilder = DefaultDockerClientConfig.createDefaultConfigBuilder();
        if (StrUtil.isNotBlank(sandboxProperties.getDockerHost())) {
            configBuilder.withDockerHost(sandboxProperties.getDockerHost());
        }
        DockerClientConfig config = configBuilder.build();
        DockerHttpClient httpClient = new ApacheDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public EnvironmentProvider environmentProvider(DockerClient dockerClient) {
        return new DockerEnvironmentProvider(dockerClient);
    }

    @Bean
    public LanguageProfileTable languageProfileTable(SandboxProperties sandboxProperties) {
        return new LanguageProfileTable(sandboxProperties.getImages());
    }

    @Bean
    public MemoryProfileAccountant memoryProfileAccountant(SandboxProperties sandboxProperties) {
        return new MemoryProfileAccountant(sandboxProperties.getMaxSamples());
    }

    @Bean
    public TimeoutSupervisor timeoutSupervisor(SandboxProperties sandboxProperties) {
        return new TimeoutSupervisor(sandboxProperties.getPollInterval());
    }
}
